package com.docstore.repositories.mongo;

import com.docstore.core.ConfigurationException;
import com.docstore.core.DocumentStore;
import com.docstore.core.Plugin;
import com.docstore.core.StorageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class MongoPlugin implements Plugin {
    private final Logger logger;
    private final List<DocumentStore> stores = new CopyOnWriteArrayList<>();

    public MongoPlugin() {
        this(LoggerFactory.getLogger(MongoDocumentStore.class));
    }

    /**
     * @param logger handed to every store this plugin creates
     */
    public MongoPlugin(Logger logger) {
        this.logger = logger;
    }

    @Override
    public DocumentStore createStore(StorageConfig sc) {
        if (!(sc instanceof MongoConfig)) {
            throw new ConfigurationException("type",
                    "expected " + MongoConfig.TYPE + " configuration, got " + (sc == null ? null : sc.type()));
        }
        MongoDocumentStore store = new MongoDocumentStore((MongoConfig) sc, logger);
        stores.add(store);
        return store;
    }

    @Override
    public void cleanUp() {
        for (DocumentStore store : stores) {
            store.disconnect();
        }
        stores.clear();
    }
}
