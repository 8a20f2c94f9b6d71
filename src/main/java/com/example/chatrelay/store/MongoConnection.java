package com.example.chatrelay.store;

import com.mongodb.client.MongoClient;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * A client handle scoped to a single store operation. Closing it closes the underlying
 * {@link MongoClient}.
 */
public class MongoConnection implements AutoCloseable {

    private final MongoClient client;
    private final MongoTemplate template;
    private final String collection;

    public MongoConnection(MongoClient client, MongoTemplate template, String collection) {
        this.client = client;
        this.template = template;
        this.collection = collection;
    }

    public MongoTemplate template() {
        return template;
    }

    public String collection() {
        return collection;
    }

    @Override
    public void close() {
        client.close();
    }
}
