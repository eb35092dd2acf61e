package org.carball.pgmaint.advisor;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.pgmaint.catalog.InMemoryCatalogReader;
import org.carball.pgmaint.catalog.InMemoryCatalogReader.Operation;
import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.model.recommendation.IndexRecommendation;
import org.carball.pgmaint.model.recommendation.RecommendationType;
import org.carball.pgmaint.model.recommendation.Severity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class RecommendationEngineTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;
    private InMemoryCatalogReader catalog;
    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger("test.recommendation-engine");
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);

        catalog = new InMemoryCatalogReader();
        engine = new RecommendationEngine(catalog, "public", logger);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldNotFlagUnusedPrimaryKeyIndex() throws Exception {
        // Given
        catalog.index("users", "pk_users", true, 0, "id");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).isEmpty();
    }

    @Test
    void shouldFlagUnusedNonPrimaryIndexWithMediumSeverity() throws Exception {
        // Given
        catalog.index("orders", "pk_orders", true, 120, "id")
                .index("orders", "idx_orders_status", false, 0, "status")
                .index("orders", "idx_orders_created_at", false, 42, "created_at");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).singleElement().satisfies(rec -> {
            assertThat(rec.getType()).isEqualTo(RecommendationType.UNUSED_INDEX);
            assertThat(rec.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(rec.getTable()).isEqualTo("orders");
            assertThat(rec.getIndex()).isEqualTo("idx_orders_status");
            assertThat(rec.getDescription()).isEqualTo("Index idx_orders_status on table orders is not being used");
            assertThat(rec.getAction()).isEqualTo("Consider dropping index idx_orders_status");
            assertThat(rec.maintenanceStatement()).isEmpty();
        });
    }

    @Test
    void shouldTreatIndexWithoutUsageRowAsUnused() throws Exception {
        // Given
        catalog.indexWithoutUsage("orders", "idx_orders_note", "note");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::getType, IndexRecommendation::getIndex)
                .containsExactly(tuple(RecommendationType.UNUSED_INDEX, "idx_orders_note"));
    }

    @Test
    void shouldKeepUsageOfEquallyNamedIndexesOnDifferentTablesApart() throws Exception {
        // Given
        catalog.index("orders", "idx_status", false, 0, "status")
                .index("shipments", "idx_status", false, 17, "status");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::getTable).containsExactly("orders");
    }

    @Test
    void shouldRecommendIndexForUncoveredForeignKey() throws Exception {
        // Given
        catalog.index("orders", "pk_orders", true, 10, "id")
                .foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).singleElement().satisfies(rec -> {
            assertThat(rec.getType()).isEqualTo(RecommendationType.MISSING_FK_INDEX);
            assertThat(rec.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(rec.getTable()).isEqualTo("orders");
            assertThat(rec.getColumn()).isEqualTo("customer_id");
            assertThat(rec.getDescription())
                    .isEqualTo("Foreign key orders.customer_id references customers.id but has no index");
            assertThat(rec.getAction()).isEqualTo("Create index on orders.customer_id");
            assertThat(rec.maintenanceStatement())
                    .contains("CREATE INDEX idx_orders_customer_id ON orders (customer_id)");
        });
    }

    @Test
    void shouldAcceptForeignKeyCoveredByLeadingColumnOfCompositeIndex() throws Exception {
        // Given
        catalog.index("orders", "idx_orders_customer_created", false, 5, "customer_id", "created_at")
                .foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).isEmpty();
    }

    @Test
    void shouldNotTreatTrailingIndexColumnAsForeignKeyCoverage() throws Exception {
        // Given
        catalog.index("orders", "idx_orders_created_customer", false, 5, "created_at", "customer_id")
                .foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::getType)
                .containsExactly(RecommendationType.MISSING_FK_INDEX);
    }

    @Test
    void shouldNotMatchForeignKeyColumnBySubstring() throws Exception {
        // Given - an index on "customer_id_old" must not count for "customer_id"
        catalog.index("orders", "idx_orders_customer_id_old", false, 5, "customer_id_old")
                .foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::getType, IndexRecommendation::getColumn)
                .containsExactly(tuple(RecommendationType.MISSING_FK_INDEX, "customer_id"));
    }

    @Test
    void shouldReportMultiColumnForeignKeyOnceWithFullColumnList() throws Exception {
        // Given
        catalog.index("order_lines", "idx_order_lines_order", false, 3, "order_id")
                .foreignKey("order_lines_shipment_fkey", "order_lines", "order_id", "shipments", "order_id")
                .foreignKey("order_lines_shipment_fkey", "order_lines", "line_no", "shipments", "line_no");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).singleElement().satisfies(rec -> {
            assertThat(rec.getType()).isEqualTo(RecommendationType.MISSING_FK_INDEX);
            assertThat(rec.getColumn()).isEqualTo("order_id, line_no");
            assertThat(rec.maintenanceStatement())
                    .contains("CREATE INDEX idx_order_lines_order_id_line_no ON order_lines (order_id, line_no)");
        });
        assertThat(catalog.getCoverageChecks()).containsExactly("order_lines(order_id,line_no)");
    }

    @Test
    void shouldReportDuplicatePairOnce() throws Exception {
        // Given
        catalog.index("orders", "idx_orders_customer_a", false, 3, "customer_id")
                .index("orders", "idx_orders_customer_b", false, 9, "customer_id");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).singleElement().satisfies(rec -> {
            assertThat(rec.getType()).isEqualTo(RecommendationType.DUPLICATE_INDEX);
            assertThat(rec.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(rec.getTable()).isEqualTo("orders");
            assertThat(rec.getIndex()).isEqualTo("idx_orders_customer_a");
            assertThat(rec.getRelatedIndex()).isEqualTo("idx_orders_customer_b");
            assertThat(rec.getDescription())
                    .isEqualTo("Indexes idx_orders_customer_a and idx_orders_customer_b on table orders have identical columns");
        });
    }

    @Test
    void shouldReportEveryUnorderedPairAmongThreeIdenticalIndexes() throws Exception {
        // Given
        catalog.index("orders", "c_idx", false, 1, "status")
                .index("orders", "a_idx", false, 1, "status")
                .index("orders", "b_idx", false, 1, "status");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations)
                .extracting(IndexRecommendation::getIndex, IndexRecommendation::getRelatedIndex)
                .containsExactly(tuple("a_idx", "b_idx"), tuple("a_idx", "c_idx"), tuple("b_idx", "c_idx"));
    }

    @Test
    void shouldNotTreatDifferentColumnOrderOrDifferentTablesAsDuplicates() throws Exception {
        // Given
        catalog.index("orders", "idx_a", false, 1, "customer_id", "status")
                .index("orders", "idx_b", false, 1, "status", "customer_id")
                .index("invoices", "idx_c", false, 1, "customer_id", "status");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).isEmpty();
    }

    @Test
    void shouldNotTreatIndexWithLeadingExpressionAsDuplicateOrForeignKeyCoverage() throws Exception {
        // Given
        catalog.index("orders", "idx_orders_email_customer", false, 4, "lower(email)", "customer_id")
                .index("orders", "idx_orders_customer", false, 4, "customer_id")
                .foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id")
                .foreignKey("orders_referrer_id_fkey", "orders", "referrer_id", "customers", "id")
                .index("orders", "idx_orders_lower_email", false, 4, "lower(email)");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations)
                .extracting(IndexRecommendation::getType, IndexRecommendation::getColumn)
                .containsExactly(tuple(RecommendationType.MISSING_FK_INDEX, "referrer_id"));
    }

    @Test
    void shouldProduceIdenticalResultsOnRepeatedRuns() throws Exception {
        // Given
        catalog.index("orders", "pk_orders", true, 0, "id")
                .index("orders", "idx_orders_status", false, 0, "status")
                .index("orders", "idx_orders_status_dup", false, 4, "status")
                .foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id");

        // When
        List<IndexRecommendation> first = engine.analyzeIndexes(CancellationSignal.none());
        List<IndexRecommendation> second = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(second).isEqualTo(first);
        assertThat(first).extracting(IndexRecommendation::getType).containsExactly(
                RecommendationType.UNUSED_INDEX,
                RecommendationType.MISSING_FK_INDEX,
                RecommendationType.DUPLICATE_INDEX);
    }

    @Test
    void shouldOmitForeignKeyPassAndKeepOthersWhenConstraintsCannotBeRead() throws Exception {
        // Given
        catalog.index("orders", "idx_orders_status", false, 0, "status")
                .index("orders", "idx_orders_status_dup", false, 2, "status")
                .foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id")
                .failOn(Operation.FOREIGN_KEYS);

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::getType)
                .containsExactly(RecommendationType.UNUSED_INDEX, RecommendationType.DUPLICATE_INDEX);
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage()).contains("missing-fk-index"));
    }

    @Test
    void shouldSkipSingleForeignKeyWhoseCoverageCheckFails() throws Exception {
        // Given
        catalog.foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id")
                .foreignKey("payments_order_id_fkey", "payments", "order_id", "orders", "id")
                .failCoverageCheckFor("orders");

        // When
        List<IndexRecommendation> recommendations = engine.analyzeIndexes(CancellationSignal.none());

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::getTable).containsExactly("payments");
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage()).contains("orders.customer_id"));
    }

    @Test
    void shouldFailWhenIndexListCannotBeRead() {
        // Given
        catalog.index("orders", "idx_orders_status", false, 0, "status")
                .failOn(Operation.LIST_INDEXES);

        // When / Then
        assertThatThrownBy(() -> engine.analyzeIndexes(CancellationSignal.none()))
                .isInstanceOf(CatalogReadException.class);
    }

    @Test
    void shouldPropagateCancellationInsteadOfOmittingPass() {
        // Given
        catalog.foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id");
        CancellationSignal signal = CancellationSignal.none();
        signal.cancel();

        // When / Then
        assertThatThrownBy(() -> engine.analyzeIndexes(signal)).isInstanceOf(CancellationException.class);
        assertThat(catalog.getCoverageChecks()).isEmpty();
    }
}
