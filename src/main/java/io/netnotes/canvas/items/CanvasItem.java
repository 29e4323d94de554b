package io.netnotes.canvas.items;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.google.gson.JsonObject;

import io.netnotes.canvas.geometry.Affine2D;
import io.netnotes.canvas.geometry.Point2D;
import io.netnotes.canvas.paint.PaintState;

/**
 * CanvasItem - A drawable entity on the canvas
 *
 * Items are identity objects: two items are the same item only if they are the
 * same instance. The core never holds one outside the {@link ItemStore}; every
 * other component refers to it through its {@link ItemId}.
 *
 * Kind-specific geometry (path elements, rect bounds, text, pixmap data) is an
 * opaque JSON payload that the core stores and round-trips but never reads.
 */
public class CanvasItem {
    private final ItemKind kind;
    private final JsonObject shape;

    private Point2D position = Point2D.ORIGIN;
    private Affine2D transform = Affine2D.IDENTITY;
    private double zValue = 0;
    private boolean visible = true;
    private double opacity = 1.0;
    private boolean selectable = true;
    private boolean movable = true;
    private PaintState paint = PaintState.DEFAULT;

    private CanvasItem parent = null;
    private final List<CanvasItem> children = new ArrayList<>();

    private boolean disposed = false;

    public CanvasItem(ItemKind kind) {
        this(kind, new JsonObject());
    }

    public CanvasItem(ItemKind kind, JsonObject shape) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.shape = shape != null ? shape.deepCopy() : new JsonObject();
    }

    /**
     * Creates a GROUP item that takes the given items as its children.
     */
    public static CanvasItem group(List<CanvasItem> members) {
        CanvasItem group = new CanvasItem(ItemKind.GROUP);
        for (CanvasItem member : members) {
            group.addChild(member);
        }
        return group;
    }

    public ItemKind getKind() {
        return kind;
    }

    public JsonObject getShape() {
        return shape.deepCopy();
    }

    public Point2D getPosition() {
        return position;
    }

    public void setPosition(Point2D position) {
        this.position = position != null ? position : Point2D.ORIGIN;
    }

    public Affine2D getTransform() {
        return transform;
    }

    public void setTransform(Affine2D transform) {
        this.transform = transform != null ? transform : Affine2D.IDENTITY;
    }

    public double getZValue() {
        return zValue;
    }

    public void setZValue(double zValue) {
        this.zValue = zValue;
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    public double getOpacity() {
        return opacity;
    }

    public void setOpacity(double opacity) {
        this.opacity = Math.max(0.0, Math.min(1.0, opacity));
    }

    public boolean isSelectable() {
        return selectable;
    }

    public void setSelectable(boolean selectable) {
        this.selectable = selectable;
    }

    public boolean isMovable() {
        return movable;
    }

    public void setMovable(boolean movable) {
        this.movable = movable;
    }

    public PaintState getPaint() {
        return paint;
    }

    public void setPaint(PaintState paint) {
        this.paint = paint != null ? paint : PaintState.DEFAULT;
    }

    // ===== HIERARCHY =====

    public CanvasItem getParent() {
        return parent;
    }

    public List<CanvasItem> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public void addChild(CanvasItem child) {
        if (child == null || child == this || children.contains(child)) {
            return;
        }
        if (child.parent != null) {
            child.parent.children.remove(child);
        }
        child.parent = this;
        children.add(child);
    }

    public boolean removeChild(CanvasItem child) {
        if (child != null && children.remove(child)) {
            child.parent = null;
            return true;
        }
        return false;
    }

    /**
     * Pre-order list of every descendant.
     */
    public List<CanvasItem> getDescendants() {
        List<CanvasItem> out = new ArrayList<>();
        collectDescendants(this, out);
        return out;
    }

    private static void collectDescendants(CanvasItem item, List<CanvasItem> out) {
        for (CanvasItem child : item.children) {
            out.add(child);
            collectDescendants(child, out);
        }
    }

    public boolean hasAncestorIn(Set<CanvasItem> items) {
        for (CanvasItem p = parent; p != null; p = p.parent) {
            if (items.contains(p)) {
                return true;
            }
        }
        return false;
    }

    // ===== LIFETIME =====

    /**
     * Releases the item and its children. Only {@link ItemStore#flushDeletions()} calls this.
     */
    void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        for (CanvasItem child : children) {
            child.dispose();
        }
    }

    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public String toString() {
        return "CanvasItem[" + kind.getTypeName() + " @" + position + (disposed ? ", disposed" : "") + "]";
    }
}
