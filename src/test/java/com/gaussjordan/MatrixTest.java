package com.gaussjordan;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Matrix}: construction checks, bounds checks and the
 * three elementary row operations.
 */
public class MatrixTest {

    private static Matrix sample() {
        return Matrix.of(new double[][]{
                { 1, 1,  2, 9 },
                { 2, 4, -3, 1 },
                { 3, 6, -5, 0 }
        });
    }

    @Test
    public void testCreateRowMajor() {
        Matrix m = Matrix.create(2, 3, 1, 2, 3, 4, 5, 6);
        assertEquals(2, m.rows());
        assertEquals(3, m.cols());
        assertEquals(3.0, m.get(0, 2));
        assertEquals(4.0, m.get(1, 0));
    }

    @Test
    public void testCreateRejectsBadShapes() {
        assertThrows(IllegalArgumentException.class, () -> Matrix.create(2, 2, 1, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> Matrix.create(0, 2));
        assertThrows(IllegalArgumentException.class, () -> Matrix.create(2, 0));
        assertThrows(IllegalArgumentException.class, () -> Matrix.of(new double[][]{ { 1, 2 }, { 3 } }));
        assertThrows(IllegalArgumentException.class, () -> Matrix.of(new double[0][]));
    }

    @Test
    public void testCreateRejectsNonFinite() {
        assertThrows(IllegalArgumentException.class, () -> Matrix.create(1, 2, 1, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Matrix.create(1, 1, Double.POSITIVE_INFINITY));
    }

    @Test
    public void testIndexOutOfRange() {
        Matrix m = sample();
        assertThrows(IndexOutOfBoundsException.class, () -> m.get(3, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> m.get(0, 4));
        assertThrows(IndexOutOfBoundsException.class, () -> m.set(-1, 0, 1.0));
        assertThrows(IndexOutOfBoundsException.class, () -> m.swapRows(0, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> m.scaleRow(5, 2.0));
        assertThrows(IndexOutOfBoundsException.class, () -> m.addScaledRow(0, -1, 1.0));
    }

    @Test
    public void testSwapTwiceRestoresExactly() {
        Matrix m = Matrix.of(new double[][]{ { 0.1, 0.2 }, { 1.0 / 3, -7e-12 } });
        Matrix before = m.copy();
        m.swapRows(0, 1);
        assertEquals(1.0 / 3, m.get(0, 0));
        assertNotEquals(before, m);
        m.swapRows(0, 1);
        assertEquals(before, m);
    }

    @Test
    public void testSwapSameRowIsNoOp() {
        Matrix m = sample();
        m.swapRows(1, 1);
        assertEquals(sample(), m);
    }

    @Test
    public void testScaleAndUnscaleWithinTolerance() {
        Matrix m = sample();
        m.scaleRow(1, 3.0);
        assertEquals(-9.0, m.get(1, 2));
        m.scaleRow(1, 1.0 / 3.0);
        for (int c = 0; c < m.cols(); c++) {
            assertEquals(sample().get(1, c), m.get(1, c), Tolerance.EPSILON);
        }
    }

    @Test
    public void testScaleByZeroIsPermitted() {
        Matrix m = sample();
        m.scaleRow(0, 0.0);
        assertArrayEquals(new double[]{ 0, 0, 0, 0 }, m.row(0));
    }

    @Test
    public void testOverflowIsRejectedAtomically() {
        Matrix m = Matrix.create(2, 2, 1, 1e308, 2, 1e308);
        Matrix before = m.copy();
        ArithmeticException e = assertThrows(ArithmeticException.class, () -> m.scaleRow(0, 5e8));
        assertEquals("Overflow in scaling at (0, 1)", e.getMessage());
        assertThrows(ArithmeticException.class, () -> m.addScaledRow(1, 0, 1.0));
        assertEquals(before, m, "rows untouched");
    }

    @Test
    public void testAddScaledRow() {
        Matrix m = sample();
        m.addScaledRow(1, 0, -2.0);
        assertArrayEquals(new double[]{ 0, 2, -7, -17 }, m.row(1));
        assertArrayEquals(new double[]{ 1, 1, 2, 9 }, m.row(0), "source untouched");
    }

    @Test
    public void testCopyIsIndependent() {
        Matrix m = sample();
        Matrix c = m.copy();
        c.set(0, 0, 42.0);
        assertEquals(1.0, m.get(0, 0));
        double[][] a = m.toArray();
        a[1][1] = -1;
        assertEquals(4.0, m.get(1, 1));
        double[] r = m.row(2);
        r[0] = 99;
        assertEquals(3.0, m.get(2, 0));
    }

    @Test
    public void testWrite() throws IOException {
        StringWriter sw = new StringWriter();
        Matrix.create(2, 2, 1, -0.5, 0, 3).write(sw);
        String nl = System.lineSeparator();
        assertEquals("1.0 -0.5" + nl + "0.0 3.0" + nl, sw.toString());
    }

    @Test
    public void testHashEqualsContract() {
        assertEquals(sample(), sample());
        assertEquals(sample().hashCode(), sample().hashCode());
        assertNotEquals(sample(), Matrix.create(1, 1, 1));
    }
}
