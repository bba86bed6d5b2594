package com.jreinhal.concierge.hitl.escalation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Instant;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

class MongoReviewerDirectoryTest {

    private static final Instant AT = Instant.parse("2026-03-02T09:00:00Z");

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
    private final MongoReviewerDirectory directory = new MongoReviewerDirectory(mongoTemplate);

    @Test
    void registerUpsertsAndKeepsOriginalRegistrationTime() {
        directory.register(new Reviewer(Reviewer.storageId("acme", "rev-1"), "acme", "rev-1", "Ana", List.of("billing"),
                5, true, AT, AT));

        ArgumentCaptor<Query> queryCaptor = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> updateCaptor = ArgumentCaptor.forClass(Update.class);
        ArgumentCaptor<FindAndModifyOptions> optionsCaptor = ArgumentCaptor.forClass(FindAndModifyOptions.class);
        verify(mongoTemplate).findAndModify(queryCaptor.capture(), updateCaptor.capture(), optionsCaptor.capture(),
                eq(Reviewer.class), eq("hitl_reviewers"));
        assertEquals("acme:rev-1", queryCaptor.getValue().getQueryObject().get("_id"));
        Document update = updateCaptor.getValue().getUpdateObject();
        assertEquals(AT, update.get("$setOnInsert", Document.class).get("registeredAt"));
        assertEquals(5, update.get("$set", Document.class).get("maxWorkload"));
        assertTrue(optionsCaptor.getValue().isUpsert());
    }

    @Test
    void availabilityChangeIsTenantScoped() {
        assertTrue(directory.setAvailability("acme", "rev-1", false, AT).isEmpty());

        ArgumentCaptor<Query> queryCaptor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).findAndModify(queryCaptor.capture(), any(Update.class),
                any(FindAndModifyOptions.class), eq(Reviewer.class), eq("hitl_reviewers"));
        Document query = queryCaptor.getValue().getQueryObject();
        assertEquals("acme:rev-1", query.get("_id"));
        assertEquals("acme", query.get("tenantId"));
    }

    @Test
    void findAvailableIsOrderedByReviewerId() {
        directory.findAvailable("acme");

        ArgumentCaptor<Query> queryCaptor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(queryCaptor.capture(), eq(Reviewer.class), eq("hitl_reviewers"));
        assertEquals(Boolean.TRUE, queryCaptor.getValue().getQueryObject().get("available"));
        assertEquals(1, queryCaptor.getValue().getSortObject().get("reviewerId"));
    }
}
