package projectpelagic.domain.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridLayerTest {

    @Test
    @DisplayName("La matriz [x][y] se empaqueta como x * ny + y")
    void of_packsRowMajorByLongitude() {
        GridLayer layer = GridLayer.of(new float[][]{{1f, 2f, 3f}, {4f, 5f, 6f}});

        assertThat(layer.shape()).isEqualTo(new GridShape(2, 3));
        assertThat(layer.get(1, 2)).isEqualTo(6f);
        assertThat(layer.getAt(1 * 3 + 0)).isEqualTo(4f);
    }

    @Test
    @DisplayName("El máximo finito ignora los NaN y es NaN si no hay valores")
    void finiteMax_ignoresMissing() {
        assertThat(GridLayer.of(new float[][]{{Float.NaN, 2f}, {7f, Float.NaN}}).finiteMax()).isEqualTo(7f);
        assertThat(GridLayer.of(new float[][]{{Float.NaN}}).finiteMax()).isNaN();
    }

    @Test
    @DisplayName("La capa copia el array de entrada")
    void constructor_copiesValues() {
        float[] values = {1f, 2f};
        GridLayer layer = new GridLayer(1, 2, values);
        values[0] = 99f;

        assertThat(layer.get(0, 0)).isEqualTo(1f);
    }

    @Test
    @DisplayName("Modificar el array devuelto por values() no altera la capa")
    void values_returnsCopy() {
        GridLayer layer = GridLayer.of(new float[][]{{1f, 2f}});

        layer.values()[0] = 99f;
        layer.toArray()[1] = 99f;

        assertThat(layer.getAt(0)).isEqualTo(1f);
        assertThat(layer.getAt(1)).isEqualTo(2f);
    }

    @Test
    @DisplayName("Acceder fuera de la rejilla lanza excepción")
    void get_outOfBounds_throws() {
        GridLayer layer = GridLayer.zeros(new GridShape(2, 2));

        assertThatThrownBy(() -> layer.get(2, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @DisplayName("Un array de tamaño distinto a nx * ny se rechaza")
    void constructor_wrongSize_throws() {
        assertThatThrownBy(() -> new GridLayer(2, 2, new float[3])).isInstanceOf(IllegalArgumentException.class);
    }
}
