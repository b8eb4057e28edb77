package io.quadc.core.model;

/** Reference cell shapes. */
public enum CellShape {
    INTERVAL(1, 2),
    TRIANGLE(2, 3),
    TETRAHEDRON(3, 4),
    QUADRILATERAL(2, 4),
    HEXAHEDRON(3, 6);

    private final int geometricDimension;
    private final int numFacets;

    CellShape(int geometricDimension, int numFacets) {
        this.geometricDimension = geometricDimension;
        this.numFacets = numFacets;
    }

    public int geometricDimension() {
        return geometricDimension;
    }

    public int numFacets() {
        return numFacets;
    }
}
