package io.github.eutro.exir.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A position in the source program, as recorded by the lowering stage.
 */
public final class SourcePos {
    public final String file;
    public final int line;
    public final int column;

    public SourcePos(@NotNull String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourcePos that = (SourcePos) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
