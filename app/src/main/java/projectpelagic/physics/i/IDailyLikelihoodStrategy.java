package projectpelagic.physics.i;

import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.grid.GridField;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.RunGeometry;
import projectpelagic.domain.tag.TagObservation;

import java.util.List;

/**
 * Cálculo de la verosimilitud combinada (sin normalizar) de un único día.
 * <p>
 * Las implementaciones no tienen estado mutable: una misma instancia se comparte entre
 * todos los trabajadores del pool.
 */
public interface IDailyLikelihoodStrategy {

    String getName();

    LikelihoodConfig.Mode getMode();

    /**
     * @param observations Observaciones de la marca de ese día.
     * @param field        Campo de referencia del día, ya agregado a la forma de la ejecución.
     * @param geometry     Geometría fijada para la ejecución (ventana, máscara externa).
     * @return Rejilla combinada con la forma de {@code geometry}.
     */
    GridLayer computeDay(List<TagObservation> observations, GridField field, RunGeometry geometry);
}
