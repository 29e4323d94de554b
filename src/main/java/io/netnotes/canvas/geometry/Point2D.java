package io.netnotes.canvas.geometry;

import com.google.gson.JsonObject;

import io.netnotes.canvas.utils.JsonHelpers;

public class Point2D {
    public static final Point2D ORIGIN = new Point2D(0, 0);

    private final double x;
    private final double y;

    public Point2D(double x, double y){
        this.x = x;
        this.y = y;
    }

    public double getX(){
        return x;
    }

    public double getY(){
        return y;
    }

    public Point2D subtract(Point2D point) {
        return new Point2D(this.x - point.x, this.y - point.y);
    }

    public Point2D add(Point2D point) {
        return new Point2D(this.x + point.x, this.y + point.y);
    }

    public Point2D scale(double sx, double sy){
        return new Point2D(x * sx, y * sy);
    }

    public JsonObject toJson(){
        JsonObject json = new JsonObject();
        json.addProperty("x", x);
        json.addProperty("y", y);
        return json;
    }

    public static Point2D fromJson(JsonObject json){
        if(json == null){
            return ORIGIN;
        }
        return new Point2D(JsonHelpers.getDouble(json, "x", 0), JsonHelpers.getDouble(json, "y", 0));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point2D other)) return false;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
