package projectpelagic.domain.grid;

/**
 * Dimensiones espaciales (longitud x latitud) de una rejilla.
 *
 * @param nx Número de celdas en longitud.
 * @param ny Número de celdas en latitud.
 */
public record GridShape(int nx, int ny) {

    public GridShape {
        if (nx <= 0 || ny <= 0) {
            throw new IllegalArgumentException("Las dimensiones de la rejilla deben ser positivas: " + nx + "x" + ny);
        }
    }

    public int cellCount() {
        return nx * ny;
    }

    @Override
    public String toString() {
        return nx + "x" + ny;
    }
}
