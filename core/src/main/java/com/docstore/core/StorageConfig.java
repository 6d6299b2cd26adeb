package com.docstore.core;

/**
 * Configuration for one storage back end. Each {@link Plugin} knows its own type.
 */
public interface StorageConfig {
    String type();
}
