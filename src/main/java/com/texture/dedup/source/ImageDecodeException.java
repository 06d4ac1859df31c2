package com.texture.dedup.source;

/**
 * Thrown when an item's image cannot be read or decoded.
 */
public class ImageDecodeException extends Exception {

    private final String itemId;

    public ImageDecodeException(String itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public ImageDecodeException(String itemId, String message, Throwable cause) {
        super(message, cause);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
