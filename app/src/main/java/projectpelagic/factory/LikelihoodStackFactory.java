package projectpelagic.factory;

import lombok.extern.slf4j.Slf4j;
import projectpelagic.domain.grid.GridShape;
import projectpelagic.domain.likelihood.DayResult;
import projectpelagic.domain.likelihood.LikelihoodStack;
import projectpelagic.physics.solver.LikelihoodNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ensamblado secuencial de la pila de salida a partir de los resultados diarios.
 * <p>
 * Es el único punto que escribe en la pila: los trabajadores nunca la tocan.
 */
@Slf4j
public class LikelihoodStackFactory {

    /**
     * Reserva una pila de ceros de tamaño completo.
     */
    public static LikelihoodStack allocate(GridShape shape, int slotCount) {
        log.debug("Reservando pila de salida {} x {} huecos.", shape, slotCount);
        return new LikelihoodStack(shape, slotCount);
    }

    /**
     * Escribe cada resultado exitoso, ya normalizado, en su hueco. Los días fallidos
     * dejan su hueco a cero.
     *
     * @throws IllegalStateException si dos resultados reclaman el mismo hueco.
     */
    public static LikelihoodStack assemble(LikelihoodStack stack, List<DayResult> results) {
        List<DayResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingInt(DayResult::slot));

        Set<Integer> written = new HashSet<>();
        for (DayResult result : ordered) {
            if (!written.add(result.slot())) {
                throw new IllegalStateException("Hueco duplicado en el ensamblado: " + result.slot());
            }
            if (result.isSuccess()) {
                stack.setSlot(result.slot(), LikelihoodNormalizer.normalize(result.likelihood()));
            }
        }
        return stack;
    }

    public static LikelihoodStack assemble(GridShape shape, int slotCount, List<DayResult> results) {
        return assemble(allocate(shape, slotCount), results);
    }
}
