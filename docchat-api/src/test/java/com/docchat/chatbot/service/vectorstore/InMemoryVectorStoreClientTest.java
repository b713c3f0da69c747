package com.docchat.chatbot.service.vectorstore;

import com.docchat.chatbot.error.VectorStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryVectorStoreClientTest {

    private InMemoryVectorStoreClient store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStoreClient();
        store.ensureCollection("documents", 2, DistanceMetric.COSINE);
    }

    @Test
    void searchOrdersByScoreAndAppliesThreshold() {
        store.upsert("documents", List.of(
                point("a-0", "a", 0, 1.0, 0.0),
                point("b-0", "b", 0, 0.0, 1.0),
                point("c-0", "c", 0, 0.8, 0.6)
        ));

        List<ScoredPoint> hits = store.search("documents", List.of(1.0, 0.0), 5, 0.3);

        assertThat(hits).extracting(ScoredPoint::id).containsExactly("a-0", "c-0");
        assertThat(hits.get(0).score()).isCloseTo(1.0, within(1e-9));
        assertThat(hits.get(1).score()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void tiesKeepInsertionOrderAndTopKLimits() {
        store.upsert("documents", List.of(
                point("first-0", "first", 0, 1.0, 0.0),
                point("second-0", "second", 0, 1.0, 0.0),
                point("third-0", "third", 0, 1.0, 0.0)
        ));

        List<ScoredPoint> hits = store.search("documents", List.of(1.0, 0.0), 2, 0.0);

        assertThat(hits).extracting(ScoredPoint::id).containsExactly("first-0", "second-0");
    }

    @Test
    void upsertReplacesPointWithSameId() {
        store.upsert("documents", List.of(point("a-0", "a", 0, 1.0, 0.0)));
        store.upsert("documents", List.of(point("a-0", "a", 0, 0.0, 1.0)));

        assertThat(store.describe("documents").vectorsCount()).isEqualTo(1);
        assertThat(store.search("documents", List.of(0.0, 1.0), 5, 0.9)).extracting(ScoredPoint::id).containsExactly("a-0");
    }

    @Test
    void rejectsDimensionMismatch() {
        assertThatThrownBy(() -> store.ensureCollection("documents", 3, DistanceMetric.COSINE))
                .isInstanceOf(VectorStoreException.class);
        assertThatThrownBy(() -> store.upsert("documents", List.of(new IndexedPoint("x", List.of(1.0, 0.0, 0.0), Map.of()))))
                .isInstanceOf(VectorStoreException.class);
    }

    @Test
    void missingCollectionSearchesEmptyAndDescribesAsNotCreated() {
        assertThat(store.search("other", List.of(1.0, 0.0), 5, 0.0)).isEmpty();
        assertThat(store.describe("other")).isEqualTo(CollectionInfo.notCreated("other"));
        assertThatThrownBy(() -> store.upsert("other", List.of(point("a-0", "a", 0, 1.0, 0.0))))
                .isInstanceOf(VectorStoreException.class);
    }

    @Test
    void deleteDocumentChunksFromRemovesOnlyTrailingChunksOfThatDocument() {
        store.upsert("documents", List.of(
                point("a-0", "a", 0, 1.0, 0.0),
                point("a-1", "a", 1, 1.0, 0.0),
                point("a-2", "a", 2, 1.0, 0.0),
                point("b-2", "b", 2, 1.0, 0.0)
        ));

        store.deleteDocumentChunksFrom("documents", "a", 1);

        assertThat(store.search("documents", List.of(1.0, 0.0), 10, 0.0))
                .extracting(ScoredPoint::id)
                .containsExactly("a-0", "b-2");
    }

    @Test
    void deleteCollectionDropsEverything() {
        store.upsert("documents", List.of(point("a-0", "a", 0, 1.0, 0.0)));

        store.deleteCollection("documents");

        assertThat(store.describe("documents").status()).isEqualTo("not_created");
        assertThat(store.search("documents", List.of(1.0, 0.0), 5, 0.0)).isEmpty();
    }

    private static IndexedPoint point(String id, String documentId, int index, double x, double y) {
        return new IndexedPoint(id, List.of(x, y), Map.of(
                PointPayload.CHUNK_ID, id,
                PointPayload.DOCUMENT_ID, documentId,
                PointPayload.CHUNK_INDEX, index,
                PointPayload.TEXT, "text of " + id));
    }
}
