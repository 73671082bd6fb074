package br.ufmg.cs.systems.canon.pattern;

import br.ufmg.cs.systems.canon.refinement.RefinementOutcome;
import org.apache.hadoop.io.WritableComparable;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;

/**
 * Canonical form of a labeled graph: vertex ids in canonical order, their
 * external labels in that order, and the upper triangle of the adjacency
 * matrix of the graph under that order. Forms are ordered by labels first and
 * then by matrix rows.
 */
public class CanonicalForm extends RefinementOutcome
        implements WritableComparable<CanonicalForm> {
   private int[] nodeOrder;
   private int[] orderedLabels;
   private boolean[][] matrix;

   public CanonicalForm() {
      this(new int[0], new int[0], new boolean[0][]);
   }

   /**
    * @param matrix upper triangle of the adjacency matrix: row {@code i} has
    *               {@code n - 1 - i} cells, cell {@code k} standing for
    *               vertex {@code i + 1 + k}
    */
   public CanonicalForm(int[] nodeOrder, int[] orderedLabels, boolean[][] matrix) {
      if (nodeOrder.length != orderedLabels.length || nodeOrder.length != matrix.length) {
         throw new IllegalArgumentException("Order, labels and matrix sizes differ: " +
                 nodeOrder.length + ", " + orderedLabels.length + ", " + matrix.length);
      }
      for (int i = 0; i < matrix.length; ++i) {
         if (matrix[i].length != matrix.length - 1 - i) {
            throw new IllegalArgumentException("Row " + i + " has " +
                    matrix[i].length + " cells, expected " + (matrix.length - 1 - i));
         }
      }
      this.nodeOrder = nodeOrder;
      this.orderedLabels = orderedLabels;
      this.matrix = matrix;
   }

   public static CanonicalForm empty() {
      return new CanonicalForm();
   }

   public int numVertices() {
      return nodeOrder.length;
   }

   /**
    * @return vertex ids; the i-th entry is the vertex placed at position i
    */
   public int[] getNodeOrder() {
      return nodeOrder.clone();
   }

   public int[] getOrderedLabels() {
      return orderedLabels.clone();
   }

   /**
    * Adjacency of the vertices at canonical positions {@code i} and
    * {@code j}, read from the upper triangle.
    *
    * @throws IllegalArgumentException if {@code i == j}
    */
   public boolean isAdjacent(int i, int j) {
      if (i == j) {
         throw new IllegalArgumentException("No diagonal cell for position " + i);
      }
      int low = Math.min(i, j);
      int high = Math.max(i, j);
      return matrix[low][high - low - 1];
   }

   /**
    * @return cells of row {@code i} for positions {@code i + 1} onwards
    */
   public boolean[] getRow(int i) {
      return matrix[i].clone();
   }

   public int numEdges() {
      int numEdges = 0;
      for (boolean[] row : matrix) {
         for (boolean cell : row) {
            if (cell) ++numEdges;
         }
      }
      return numEdges;
   }

   @Override
   public boolean isCanonical() {
      return true;
   }

   @Override
   public int compareSameKind(RefinementOutcome other) {
      return compareTo((CanonicalForm) other);
   }

   @Override
   public int compareTo(CanonicalForm o) {
      int len = Math.min(orderedLabels.length, o.orderedLabels.length);
      for (int i = 0; i < len; ++i) {
         if (orderedLabels[i] != o.orderedLabels[i]) {
            return Integer.compare(orderedLabels[i], o.orderedLabels[i]);
         }
      }
      if (orderedLabels.length != o.orderedLabels.length) {
         return Integer.compare(orderedLabels.length, o.orderedLabels.length);
      }

      int numRows = Math.min(matrix.length, o.matrix.length);
      for (int i = 0; i < numRows; ++i) {
         int r = compareRows(matrix[i], o.matrix[i]);
         if (r != 0) {
            return r;
         }
      }
      return Integer.compare(matrix.length, o.matrix.length);
   }

   private static int compareRows(boolean[] a, boolean[] b) {
      int len = Math.min(a.length, b.length);
      for (int i = 0; i < len; ++i) {
         if (a[i] != b[i]) {
            return Boolean.compare(a[i], b[i]);
         }
      }
      return Integer.compare(a.length, b.length);
   }

   @Override
   public void write(DataOutput dataOutput) throws IOException {
      int numVertices = nodeOrder.length;
      dataOutput.writeInt(numVertices);

      for (int i = 0; i < numVertices; ++i) {
         dataOutput.writeInt(nodeOrder[i]);
         dataOutput.writeInt(orderedLabels[i]);
      }

      // upper triangle, row by row, eight cells per byte
      int bit = 0;
      int current = 0;
      for (boolean[] row : matrix) {
         for (boolean cell : row) {
            if (cell) {
               current |= 1 << bit;
            }
            if (++bit == 8) {
               dataOutput.writeByte(current);
               bit = 0;
               current = 0;
            }
         }
      }
      if (bit > 0) {
         dataOutput.writeByte(current);
      }
   }

   @Override
   public void readFields(DataInput dataInput) throws IOException {
      int numVertices = dataInput.readInt();
      if (numVertices < 0) {
         throw new IOException("Negative vertex count: " + numVertices);
      }

      nodeOrder = new int[numVertices];
      orderedLabels = new int[numVertices];
      for (int i = 0; i < numVertices; ++i) {
         nodeOrder[i] = dataInput.readInt();
         orderedLabels[i] = dataInput.readInt();
      }

      matrix = new boolean[numVertices][];
      int bit = 8;
      int current = 0;
      for (int i = 0; i < numVertices; ++i) {
         matrix[i] = new boolean[numVertices - 1 - i];
         for (int k = 0; k < matrix[i].length; ++k) {
            if (bit == 8) {
               current = dataInput.readUnsignedByte();
               bit = 0;
            }
            matrix[i][k] = (current & (1 << bit)) != 0;
            ++bit;
         }
      }
   }

   /**
    * Compact text form: the ordered labels followed by the rows of the upper
    * triangle of the matrix as 0/1 strings.
    */
   public String toOutputString() {
      StringBuilder sb = new StringBuilder();
      sb.append(Arrays.toString(orderedLabels));
      for (int i = 0; i < matrix.length - 1; ++i) {
         sb.append(i == 0 ? " " : "|");
         for (boolean cell : matrix[i]) {
            sb.append(cell ? '1' : '0');
         }
      }
      return sb.toString();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      CanonicalForm that = (CanonicalForm) o;

      if (!Arrays.equals(orderedLabels, that.orderedLabels)) return false;
      return Arrays.deepEquals(matrix, that.matrix);
   }

   @Override
   public int hashCode() {
      int result = Arrays.hashCode(orderedLabels);
      result = 31 * result + Arrays.deepHashCode(matrix);
      return result;
   }

   @Override
   public String toString() {
      return "CanonicalForm{" +
              "nodeOrder=" + Arrays.toString(nodeOrder) +
              ", form=" + toOutputString() +
              '}';
   }
}
