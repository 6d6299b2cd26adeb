package com.docstore.core;

public interface Plugin {
    DocumentStore createStore(StorageConfig config);

    void cleanUp();
}
