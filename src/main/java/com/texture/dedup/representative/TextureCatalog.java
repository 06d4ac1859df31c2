package com.texture.dedup.representative;

import com.texture.dedup.core.model.TextureInfo;

import java.util.Optional;

/**
 * Read-only metadata about the textures of a corpus: original size, storage format
 * and whether the texture is referenced anywhere.
 */
public interface TextureCatalog {

    Optional<TextureInfo> find(String id);

    /**
     * Returns the metadata of {@code id}, or {@link TextureInfo#unknown(String)}.
     */
    default TextureInfo get(String id) {
        return find(id).orElseGet(() -> TextureInfo.unknown(id));
    }

    /**
     * A catalog that knows nothing.
     */
    static TextureCatalog empty() {
        return id -> Optional.empty();
    }
}
