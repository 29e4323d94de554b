package io.netnotes.canvas.geometry;

import com.google.gson.JsonObject;

import io.netnotes.canvas.utils.JsonHelpers;

/**
 * Immutable 2D affine transform using row-vector convention:
 * x' = m11*x + m21*y + dx, y' = m12*x + m22*y + dy
 */
public class Affine2D {
    public static final Affine2D IDENTITY = new Affine2D(1, 0, 0, 1, 0, 0);

    private final double m11;
    private final double m12;
    private final double m21;
    private final double m22;
    private final double dx;
    private final double dy;

    public Affine2D(double m11, double m12, double m21, double m22, double dx, double dy){
        this.m11 = m11;
        this.m12 = m12;
        this.m21 = m21;
        this.m22 = m22;
        this.dx = dx;
        this.dy = dy;
    }

    public static Affine2D scaling(double sx, double sy){
        return new Affine2D(sx, 0, 0, sy, 0, 0);
    }

    public static Affine2D translation(double tx, double ty){
        return new Affine2D(1, 0, 0, 1, tx, ty);
    }

    public static Affine2D rotation(double degrees){
        double rad = Math.toRadians(degrees);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        return new Affine2D(cos, sin, -sin, cos, 0, 0);
    }

    public double getM11() { return m11; }
    public double getM12() { return m12; }
    public double getM21() { return m21; }
    public double getM22() { return m22; }
    public double getDx() { return dx; }
    public double getDy() { return dy; }

    /**
     * Returns the transform that applies this one first, then {@code next}.
     */
    public Affine2D then(Affine2D next){
        return new Affine2D(
            m11 * next.m11 + m12 * next.m21,
            m11 * next.m12 + m12 * next.m22,
            m21 * next.m11 + m22 * next.m21,
            m21 * next.m12 + m22 * next.m22,
            dx * next.m11 + dy * next.m21 + next.dx,
            dx * next.m12 + dy * next.m22 + next.dy
        );
    }

    public Point2D map(Point2D point){
        return new Point2D(
            m11 * point.getX() + m21 * point.getY() + dx,
            m12 * point.getX() + m22 * point.getY() + dy
        );
    }

    public boolean isIdentity(){
        return equals(IDENTITY);
    }

    // projective terms are kept in the file format for compatibility and are always 0,0,1 here
    public JsonObject toJson(){
        JsonObject json = new JsonObject();
        json.addProperty("m11", m11);
        json.addProperty("m12", m12);
        json.addProperty("m13", 0.0);
        json.addProperty("m21", m21);
        json.addProperty("m22", m22);
        json.addProperty("m23", 0.0);
        json.addProperty("m31", dx);
        json.addProperty("m32", dy);
        json.addProperty("m33", 1.0);
        return json;
    }

    public static Affine2D fromJson(JsonObject json){
        if(json == null){
            return IDENTITY;
        }
        return new Affine2D(
            JsonHelpers.getDouble(json, "m11", 1),
            JsonHelpers.getDouble(json, "m12", 0),
            JsonHelpers.getDouble(json, "m21", 0),
            JsonHelpers.getDouble(json, "m22", 1),
            JsonHelpers.getDouble(json, "m31", 0),
            JsonHelpers.getDouble(json, "m32", 0)
        );
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Affine2D other)) return false;
        return Double.compare(m11, other.m11) == 0
            && Double.compare(m12, other.m12) == 0
            && Double.compare(m21, other.m21) == 0
            && Double.compare(m22, other.m22) == 0
            && Double.compare(dx, other.dx) == 0
            && Double.compare(dy, other.dy) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(m11);
        result = 31 * result + Double.hashCode(m12);
        result = 31 * result + Double.hashCode(m21);
        result = 31 * result + Double.hashCode(m22);
        result = 31 * result + Double.hashCode(dx);
        result = 31 * result + Double.hashCode(dy);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Affine2D[%s, %s, %s, %s, %s, %s]", m11, m12, m21, m22, dx, dy);
    }
}
