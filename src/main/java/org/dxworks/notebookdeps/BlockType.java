package org.dxworks.notebookdeps;

public enum BlockType {
    CODE("code"),
    SQL("sql"),
    BUTTON("button"),
    BIG_NUMBER("big-number"),
    INPUT("input-"),
    NOTEBOOK_FUNCTION("notebook-function"),
    OTHER("other");

    private final String tag;

    BlockType(String tag) {
        this.tag = tag;
    }

    /**
     * Resolves a block's type tag. A missing tag means code; every {@code input-*} widget maps to
     * {@link #INPUT}; anything unknown maps to {@link #OTHER}.
     */
    public static BlockType fromTag(String tag) {
        if (tag == null) return CODE;
        if (tag.startsWith(INPUT.tag)) return INPUT;
        for (BlockType type : values()) {
            if (type != INPUT && type != OTHER && type.tag.equals(tag)) {
                return type;
            }
        }
        return OTHER;
    }
}
