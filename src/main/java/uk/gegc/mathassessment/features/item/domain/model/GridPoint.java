package uk.gegc.mathassessment.features.item.domain.model;

/**
 * Integer point on the coordinate plane.
 */
public record GridPoint(int x, int y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
