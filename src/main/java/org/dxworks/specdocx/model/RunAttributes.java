package org.dxworks.specdocx.model;

/**
 * Character formatting carried by a run. Attributes only ever get switched
 * on while descending into nested inline markup.
 */
public final class RunAttributes {

    public static final RunAttributes PLAIN = new RunAttributes(false, false, false);

    private final boolean emphasis;
    private final boolean strong;
    private final boolean code;

    private RunAttributes(boolean emphasis, boolean strong, boolean code) {
        this.emphasis = emphasis;
        this.strong = strong;
        this.code = code;
    }

    public static RunAttributes of(boolean emphasis, boolean strong, boolean code) {
        return new RunAttributes(emphasis, strong, code);
    }

    public boolean isEmphasis() {
        return emphasis;
    }

    public boolean isStrong() {
        return strong;
    }

    public boolean isCode() {
        return code;
    }

    public RunAttributes withEmphasis() {
        return new RunAttributes(true, strong, code);
    }

    public RunAttributes withStrong() {
        return new RunAttributes(emphasis, true, code);
    }

    public RunAttributes withCode() {
        return new RunAttributes(emphasis, strong, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunAttributes other)) return false;
        return emphasis == other.emphasis && strong == other.strong && code == other.code;
    }

    @Override
    public int hashCode() {
        return (emphasis ? 4 : 0) | (strong ? 2 : 0) | (code ? 1 : 0);
    }

    @Override
    public String toString() {
        return "RunAttributes{emphasis=" + emphasis + ", strong=" + strong + ", code=" + code + "}";
    }
}
