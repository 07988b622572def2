package projectpelagic.domain.likelihood;

import lombok.Getter;
import projectpelagic.domain.grid.GridLayer;
import projectpelagic.domain.grid.GridShape;

import java.util.Objects;

/**
 * Pila de salida {@code (x, y, hueco)} de verosimilitudes diarias.
 * <p>
 * Se reserva una sola vez a tamaño completo (todo ceros) antes de procesar ningún día.
 * La forma espacial es fija para toda la ejecución; sólo el ensamblado escribe en ella.
 */
public final class LikelihoodStack {

    @Getter
    private final GridShape shape;
    @Getter
    private final int slotCount;
    private final float[] data;

    public LikelihoodStack(GridShape shape, int slotCount) {
        Objects.requireNonNull(shape, "La forma de la pila no puede ser nula.");
        if (slotCount < 0) {
            throw new IllegalArgumentException("El número de huecos no puede ser negativo.");
        }
        long size = (long) shape.cellCount() * slotCount;
        if (size > Integer.MAX_VALUE - 100) {
            throw new IllegalArgumentException("La pila de salida excede el tamaño máximo de un array: " + size);
        }
        this.shape = shape;
        this.slotCount = slotCount;
        this.data = new float[(int) size];
    }

    /**
     * Escribe una capa en su hueco.
     *
     * @throws IllegalArgumentException si la capa no tiene la forma de la pila.
     */
    public void setSlot(int slot, GridLayer layer) {
        validateSlot(slot);
        if (layer.nx() != shape.nx() || layer.ny() != shape.ny()) {
            throw new IllegalArgumentException(String.format(
                    "La capa %dx%d no coincide con la forma de la pila %s.", layer.nx(), layer.ny(), shape));
        }
        System.arraycopy(layer.toArray(), 0, data, slot * shape.cellCount(), shape.cellCount());
    }

    public GridLayer getSlot(int slot) {
        validateSlot(slot);
        int cells = shape.cellCount();
        float[] copy = new float[cells];
        System.arraycopy(data, slot * cells, copy, 0, cells);
        return new GridLayer(shape.nx(), shape.ny(), copy);
    }

    public float get(int x, int y, int slot) {
        validateSlot(slot);
        return data[slot * shape.cellCount() + x * shape.ny() + y];
    }

    private void validateSlot(int slot) {
        if (slot < 0 || slot >= slotCount) {
            throw new IndexOutOfBoundsException("El hueco " + slot + " está fuera de [0, " + (slotCount - 1) + "].");
        }
    }
}
