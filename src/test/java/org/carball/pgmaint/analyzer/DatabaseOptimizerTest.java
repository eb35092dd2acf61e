package org.carball.pgmaint.analyzer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.pgmaint.catalog.CatalogSnapshot;
import org.carball.pgmaint.catalog.InMemoryCatalogReader;
import org.carball.pgmaint.catalog.SnapshotCatalogReader;
import org.carball.pgmaint.config.OptimizerThresholds;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.model.catalog.DatabaseStats;
import org.carball.pgmaint.model.query.QueryStats;
import org.carball.pgmaint.model.recommendation.IndexRecommendation;
import org.carball.pgmaint.model.recommendation.RecommendationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DatabaseOptimizerTest {

    private DatabaseOptimizer optimizer;

    @BeforeEach
    void setUp() throws Exception {
        InMemoryCatalogReader catalog = new InMemoryCatalogReader()
                .index("orders", "orders_pkey", true, 300, "id")
                .index("orders", "idx_orders_status", false, 0, "status")
                .foreignKey("orders_customer_id_fkey", "orders", "customer_id", "customers", "id")
                .table("orders", 1000, 300)
                .table("customers", 50, 0)
                .tableSize("orders", 4_194_304L)
                .tableSize("customers", 16_384L);
        CatalogSnapshot snapshot = CatalogSnapshot.capture("public", catalog,
                (min, limit, signal) -> List.of(
                        new QueryStats("SELECT pg_sleep(2)", 2000.0, 3, 3, null),
                        new QueryStats("SELECT 1", 0.1, 900, 900, null)),
                CancellationSignal.none());
        optimizer = DatabaseOptimizer.forSnapshot(new SnapshotCatalogReader(snapshot), OptimizerThresholds.defaults());
    }

    @Test
    void shouldAnalyzeIndexesOfSnapshot() throws Exception {
        List<IndexRecommendation> recommendations = optimizer.analyzeIndexes(CancellationSignal.none());

        assertThat(recommendations)
                .extracting(IndexRecommendation::getType)
                .containsExactly(RecommendationType.UNUSED_INDEX, RecommendationType.MISSING_FK_INDEX);
    }

    @Test
    void shouldReportOnlySlowStatements() throws Exception {
        assertThat(optimizer.analyzeSlowQueries(CancellationSignal.none()))
                .extracting(QueryStats::query)
                .containsExactly("SELECT pg_sleep(2)");
    }

    @Test
    void shouldSumTableSizes() throws Exception {
        DatabaseStats stats = optimizer.getDatabaseStats(CancellationSignal.none());

        assertThat(stats.totalBytes()).isEqualTo(4_210_688L);
        assertThat(stats.indexUsage().size()).isEqualTo(2);
        assertThat(optimizer.getTableStats(CancellationSignal.none())).containsOnlyKeys("orders", "customers");
    }

    @Test
    void shouldRefuseMaintenanceWithoutLiveDatabase() {
        assertThat(optimizer.supportsMaintenance()).isFalse();
        assertThatThrownBy(() -> optimizer.optimizeDatabase(CancellationSignal.none()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("live database");
    }

    @Test
    void shouldStopWhenAlreadyCancelled() {
        CancellationSignal signal = CancellationSignal.none();
        signal.cancel();

        assertThatThrownBy(() -> optimizer.getTableStats(signal))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void shouldRouteComponentLogsThroughInjectedLogger() throws Exception {
        // Given
        Logger logger = (Logger) LoggerFactory.getLogger("test.database-optimizer");
        ListAppender<ILoggingEvent> logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.INFO);
        logger.setAdditive(false);
        InMemoryCatalogReader catalog = new InMemoryCatalogReader()
                .index("orders", "idx_orders_status", false, 0, "status");
        DatabaseOptimizer injected = new DatabaseOptimizer(catalog,
                (min, limit, signal) -> List.of(new QueryStats("SELECT pg_sleep(2)", 2000.0, 3, 3, null)),
                null, OptimizerThresholds.defaults(), "public", logger);

        try {
            // When
            injected.analyzeIndexes(CancellationSignal.none());
            injected.analyzeSlowQueries(CancellationSignal.none());

            // Then
            assertThat(logAppender.list)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .contains("Index analysis produced 1 recommendations",
                            "Found 1 statements slower than 1000.0 ms");
        } finally {
            logger.detachAppender(logAppender);
        }
    }
}
