package projectpelagic.physics.simulator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.GridShape;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.timeline.AlignmentPlan;
import projectpelagic.exception.DataUnavailableException;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GridShapeResolverTest {

    private static final LocalDate D1 = LocalDate.of(2019, 9, 1);
    private static final LocalDate D2 = D1.plusDays(1);

    /**
     * Rejilla de 0.05º: la ventana derivada para 0.25º es 5.
     */
    private static GridField fineField(int n) {
        double[] lon = new double[n];
        double[] lat = new double[n];
        for (int i = 0; i < n; i++) {
            lon[i] = i * 0.05;
            lat[i] = 40 + i * 0.05;
        }
        return GridField.ofLayers(lon, lat, new double[]{0.0}, GridLayer.filled(new GridShape(n, n), 18f));
    }

    private static AlignmentPlan plan(List<LocalDate> processing) {
        Map<LocalDate, Integer> slots = Map.of(D1, 0, D2, 1);
        return new AlignmentPlan(List.of(D1, D2), List.of(), processing,
                processing.stream().collect(Collectors.toMap(d -> d, slots::get)), List.of());
    }

    @Test
    @DisplayName("La forma, los ejes y la ventana se derivan de la primera rejilla legible")
    void resolve_derivesFromFirstReadableGrid() {
        // --- 1. Arrange ---
        TimedGridFetcher fetcher = mock(TimedGridFetcher.class);
        when(fetcher.fetch(D2)).thenThrow(DataUnavailableException.forDate(D2));
        when(fetcher.fetch(D1)).thenReturn(fineField(6));
        GridShapeResolver resolver = new GridShapeResolver(LikelihoodConfig.defaults(LikelihoodConfig.Mode.SST), fetcher);

        // --- 2. Act ---
        RunGeometry geometry = resolver.resolve(plan(List.of(D2)), Set.of(D1, D2), null);

        // --- 3. Assert ---
        assertThat(geometry.shape()).isEqualTo(new GridShape(6, 6));
        assertThat(geometry.focalWindowSize()).isEqualTo(5);
        assertThat(geometry.aggregationFactor()).isEqualTo(1);
        var order = inOrder(fetcher);
        order.verify(fetcher).fetch(D2);
        order.verify(fetcher).fetch(D1);
    }

    @Test
    @DisplayName("Con agregación automática la forma es la de la rejilla agregada")
    void resolve_autoAggregate_shrinksShape() {
        TimedGridFetcher fetcher = mock(TimedGridFetcher.class);
        when(fetcher.fetch(D1)).thenReturn(fineField(6));
        LikelihoodConfig config = LikelihoodConfig.defaults(LikelihoodConfig.Mode.SST).withAutoAggregate(true);

        RunGeometry geometry = new GridShapeResolver(config, fetcher).resolve(plan(List.of(D1)), Set.of(D1), null);

        assertThat(geometry.aggregationFactor()).isEqualTo(2);
        assertThat(geometry.shape()).isEqualTo(new GridShape(3, 3));
        assertThat(geometry.focalWindowSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("La ventana configurada prevalece sobre la derivada")
    void resolve_configuredWindow_wins() {
        TimedGridFetcher fetcher = mock(TimedGridFetcher.class);
        when(fetcher.fetch(D1)).thenReturn(fineField(6));
        LikelihoodConfig config = LikelihoodConfig.defaults(LikelihoodConfig.Mode.SST).withFocalWindowSize(7);

        RunGeometry geometry = new GridShapeResolver(config, fetcher).resolve(plan(List.of(D1)), Set.of(D1), null);

        assertThat(geometry.focalWindowSize()).isEqualTo(7);
    }
}
