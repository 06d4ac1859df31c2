package com.texture.dedup.representative;

import com.texture.dedup.core.model.TextureFormat;
import com.texture.dedup.core.model.TextureInfo;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link TextureCatalog}.
 */
public class InMemoryTextureCatalog implements TextureCatalog {

    private final Map<String, TextureInfo> textures = new ConcurrentHashMap<>();

    public InMemoryTextureCatalog() {
    }

    public InMemoryTextureCatalog(Collection<TextureInfo> textures) {
        textures.forEach(this::put);
    }

    public InMemoryTextureCatalog put(TextureInfo info) {
        textures.put(info.id(), info);
        return this;
    }

    public InMemoryTextureCatalog put(String id, int width, int height, TextureFormat format, boolean used) {
        return put(new TextureInfo(id, width, height, format, used));
    }

    @Override
    public Optional<TextureInfo> find(String id) {
        return Optional.ofNullable(textures.get(id));
    }

    public int size() {
        return textures.size();
    }
}
