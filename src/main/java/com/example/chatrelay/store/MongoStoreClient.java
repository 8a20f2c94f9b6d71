package com.example.chatrelay.store;

import java.util.*;
import java.util.stream.Collectors;

import com.example.chatrelay.model.ChatMessage;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

/**
 * Every method opens its own connection and closes it before returning, whatever the outcome.
 */
@Component
public class MongoStoreClient implements StoreClient {

    private final MongoConnectionFactory connections;

    public MongoStoreClient(MongoConnectionFactory connections) {
        this.connections = connections;
    }

    @Override
    public boolean isConfigured() {
        return connections.isConfigured();
    }

    @Override
    public void insert(ChatMessage message) {
        try (MongoConnection conn = connections.open()) {
            conn.template().insert(message, conn.collection());
        }
    }

    @Override
    public List<ChatMessage> findByUser(String userId, Sort.Direction timestampOrder, int skip, int limit) {
        Query q = new Query(Criteria.where(ChatMessage.USER_ID).is(userId))
                .with(Sort.by(timestampOrder, ChatMessage.TIMESTAMP))
                .skip(skip)
                .limit(limit);
        try (MongoConnection conn = connections.open()) {
            return conn.template().find(q, ChatMessage.class, conn.collection());
        }
    }

    @Override
    public long countByUser(String userId) {
        Query q = new Query(Criteria.where(ChatMessage.USER_ID).is(userId));
        try (MongoConnection conn = connections.open()) {
            return conn.template().count(q, conn.collection());
        }
    }

    @Override
    public List<String> distinctUserIds(int skip, int limit) {
        List<Document> stages = List.of(
                new Document("$group", new Document("_id", "$" + ChatMessage.USER_ID)),
                new Document("$sort", new Document("_id", 1)),
                new Document("$skip", skip),
                new Document("$limit", limit));
        List<AggregationOperation> ops = new ArrayList<>();
        for (Document stage : stages) {
            ops.add(context -> stage);
        }
        Aggregation agg = Aggregation.newAggregation(ops);
        try (MongoConnection conn = connections.open()) {
            var results = conn.template().aggregate(agg, conn.collection(), Document.class);
            return results.getMappedResults().stream()
                    .map(d -> d.get("_id"))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
    }

    @Override
    public void ping() {
        try (MongoConnection conn = connections.open()) {
            conn.template().executeCommand(new Document("ping", 1));
        }
    }
}
