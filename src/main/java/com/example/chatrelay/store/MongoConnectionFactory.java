package com.example.chatrelay.store;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * Opens a fresh {@link MongoConnection} for every store operation. No client is kept between
 * operations, so a handle never outlives the request that opened it.
 */
@Component
public class MongoConnectionFactory {

    private final String uri;
    private final String database;
    private final String collection;

    public MongoConnectionFactory(@Value("${chatrelay.store.uri:}") String uri,
                                  @Value("${chatrelay.store.database:sobrus_customer_service}") String database,
                                  @Value("${chatrelay.store.collection:chat_messages}") String collection) {
        this.uri = trim(uri);
        this.database = trim(database);
        this.collection = trim(collection);
    }

    public boolean isConfigured() {
        return !uri.isEmpty() && !database.isEmpty() && !collection.isEmpty();
    }

    public MongoConnection open() {
        if (!isConfigured()) {
            throw new StoreNotConfiguredException("Store connection, database or collection is not configured");
        }
        MongoClient client = MongoClients.create(uri);
        try {
            return new MongoConnection(client, new MongoTemplate(client, database), collection);
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
