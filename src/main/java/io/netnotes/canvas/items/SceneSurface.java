package io.netnotes.canvas.items;

/**
 * The paintable surface items are shown on.
 *
 * The core only tells the surface when an item becomes paintable and when it
 * stops being paintable; how painting happens is up to the implementation.
 */
public interface SceneSurface {

    SceneSurface NONE = new SceneSurface() {
        @Override
        public void addToSurface(CanvasItem item) {
        }

        @Override
        public void removeFromSurface(CanvasItem item) {
        }
    };

    void addToSurface(CanvasItem item);

    void removeFromSurface(CanvasItem item);
}
