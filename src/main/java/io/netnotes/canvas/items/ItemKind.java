package io.netnotes.canvas.items;

public enum ItemKind {
    PATH("path"),
    RECT("rect"),
    ELLIPSE("ellipse"),
    LINE("line"),
    PIXMAP("pixmap"),
    TEXT("text"),
    GROUP("group");

    private final String typeName;

    ItemKind(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public static ItemKind fromTypeName(String typeName) {
        for (ItemKind kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return kind;
            }
        }
        return null;
    }
}
