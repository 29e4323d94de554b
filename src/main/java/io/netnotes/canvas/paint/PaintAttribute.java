package io.netnotes.canvas.paint;

import java.util.Objects;

/**
 * PaintAttribute - One recolorable channel of an item's {@link PaintState}
 *
 * The set of variants is closed (the constructor is private): STROKE, FILL,
 * TINT and THEME. Each variant knows how to write itself into a PaintState and
 * how to capture the current value of its own channel, so recolor actions work
 * the same way for every item kind.
 */
public abstract class PaintAttribute {

    public enum Channel {
        STROKE,
        FILL,
        TINT,
        THEME
    }

    private final Channel channel;

    private PaintAttribute(Channel channel){
        this.channel = channel;
    }

    public Channel getChannel(){
        return channel;
    }

    /**
     * @return a copy of {@code state} with this channel replaced
     */
    public abstract PaintState applyTo(PaintState state);

    /**
     * @return the value this channel currently has in {@code state}
     */
    public abstract PaintAttribute captureFrom(PaintState state);

    public static PaintAttribute stroke(int color, double width){
        return new Stroke(color, width);
    }

    public static PaintAttribute fill(int color){
        return new Fill(color);
    }

    public static PaintAttribute noFill(){
        return new Fill(null);
    }

    public static PaintAttribute tint(TintState tint){
        return new Tint(tint);
    }

    public static PaintAttribute theme(String themeName){
        return new Theme(themeName);
    }

    public static final class Stroke extends PaintAttribute {
        private final int color;
        private final double width;

        private Stroke(int color, double width){
            super(Channel.STROKE);
            this.color = color;
            this.width = width;
        }

        public int getColor() { return color; }
        public double getWidth() { return width; }

        @Override
        public PaintState applyTo(PaintState state) {
            return state.withStroke(color, width);
        }

        @Override
        public PaintAttribute captureFrom(PaintState state) {
            return new Stroke(state.getStrokeColor(), state.getStrokeWidth());
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Stroke other)) return false;
            return color == other.color && Double.compare(width, other.width) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(color, width);
        }

        @Override
        public String toString() {
            return "Stroke[" + ColorHelpers.toHexArgb(color) + ", " + width + "]";
        }
    }

    public static final class Fill extends PaintAttribute {
        private final Integer color;

        private Fill(Integer color){
            super(Channel.FILL);
            this.color = color;
        }

        public Integer getColor() { return color; }

        @Override
        public PaintState applyTo(PaintState state) {
            return state.withFill(color);
        }

        @Override
        public PaintAttribute captureFrom(PaintState state) {
            return new Fill(state.getFillColor());
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Fill other)) return false;
            return Objects.equals(color, other.color);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(color);
        }

        @Override
        public String toString() {
            return "Fill[" + (color != null ? ColorHelpers.toHexArgb(color) : "none") + "]";
        }
    }

    public static final class Tint extends PaintAttribute {
        private final TintState tint;

        private Tint(TintState tint){
            super(Channel.TINT);
            this.tint = tint != null ? tint : TintState.NONE;
        }

        public TintState getTint() { return tint; }

        @Override
        public PaintState applyTo(PaintState state) {
            return state.withTint(tint);
        }

        @Override
        public PaintAttribute captureFrom(PaintState state) {
            return new Tint(state.getTint());
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Tint other)) return false;
            return tint.equals(other.tint);
        }

        @Override
        public int hashCode() {
            return tint.hashCode();
        }

        @Override
        public String toString() {
            return "Tint[" + tint + "]";
        }
    }

    public static final class Theme extends PaintAttribute {
        private final String themeName;

        private Theme(String themeName){
            super(Channel.THEME);
            this.themeName = themeName;
        }

        public String getThemeName() { return themeName; }

        @Override
        public PaintState applyTo(PaintState state) {
            return state.withTheme(themeName);
        }

        @Override
        public PaintAttribute captureFrom(PaintState state) {
            return new Theme(state.getThemeName());
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Theme other)) return false;
            return Objects.equals(themeName, other.themeName);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(themeName);
        }

        @Override
        public String toString() {
            return "Theme[" + themeName + "]";
        }
    }
}
