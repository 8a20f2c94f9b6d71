package com.example.chatrelay.service;

import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.UserOverview;
import com.example.chatrelay.model.UserSummary;
import com.example.chatrelay.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Read side over the conversation log. Store errors are logged and turned into empty or partial
 * results; nothing here throws on a failing store.
 */
@Service
public class HistoryAggregator {

    private static final Logger logger = LoggerFactory.getLogger(HistoryAggregator.class);

    static final int SUMMARY_SIZE_IN_LISTING = 10;

    private final StoreClient storeClient;

    public HistoryAggregator(StoreClient storeClient) {
        this.storeClient = storeClient;
    }

    public boolean isStoreConfigured() {
        return storeClient.isConfigured();
    }

    /**
     * Page through a user's messages anchored on the most recent one: the window
     * {@code [skip, skip + limit)} is taken newest-first and returned oldest-first.
     */
    public List<ChatMessage> getHistory(String userId, int limit, int skip) {
        try {
            List<ChatMessage> newestFirst = new ArrayList<>(
                    storeClient.findByUser(userId, Sort.Direction.DESC, skip, limit));
            Collections.reverse(newestFirst);
            return newestFirst;
        } catch (Exception e) {
            logger.warn("Error retrieving chat history for {}: {}", userId, e.getMessage(), e);
            return List.of();
        }
    }

    public List<UserOverview> listUsers(int limit, int skip, boolean includeSummary) {
        List<String> userIds;
        try {
            userIds = storeClient.distinctUserIds(skip, limit);
        } catch (Exception e) {
            logger.warn("Error retrieving user list: {}", e.getMessage(), e);
            return List.of();
        }

        List<UserOverview> result = new ArrayList<>();
        for (String userId : userIds) {
            try {
                Optional<ChatMessage> latest = storeClient.latestByUser(userId);
                if (latest.isEmpty()) {
                    continue;
                }
                long count = storeClient.countByUser(userId);
                result.add(UserOverview.builder()
                        .userId(userId)
                        .latestMessage(latest.get())
                        .messageCount(count)
                        .lastActivity(latest.get().getTimestamp())
                        .build());
            } catch (Exception e) {
                logger.warn("Error retrieving overview for {}: {}", userId, e.getMessage(), e);
            }
        }

        // one summary query batch per user on the page
        if (includeSummary) {
            for (UserOverview overview : result) {
                overview.setConversationSummary(getUserSummary(overview.getUserId(), SUMMARY_SIZE_IN_LISTING));
            }
        }
        return result;
    }

    public UserSummary getUserSummary(String userId, int limit) {
        UserSummary summary = UserSummary.empty(userId);
        try {
            summary.setTotalMessages(storeClient.countByUser(userId));

            List<ChatMessage> recent = new ArrayList<>(
                    storeClient.findByUser(userId, Sort.Direction.DESC, 0, limit));
            Collections.reverse(recent);
            summary.setRecentMessages(recent);

            storeClient.earliestByUser(userId).ifPresent(m -> summary.setFirstActivity(m.getTimestamp()));
            storeClient.latestByUser(userId).ifPresent(m -> summary.setLastActivity(m.getTimestamp()));
        } catch (Exception e) {
            logger.warn("Error retrieving summary for {}: {}", userId, e.getMessage(), e);
        }
        return summary;
    }
}
