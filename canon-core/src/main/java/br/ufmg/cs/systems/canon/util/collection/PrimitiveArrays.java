package br.ufmg.cs.systems.canon.util.collection;

import java.util.Arrays;
import java.util.function.IntBinaryOperator;

/**
 * Sorting and comparison helpers over primitive arrays. Sorting takes an
 * explicit comparator over the elements (usually vertex positions), so the
 * resulting order never depends on anything but the keys it compares.
 */
public class PrimitiveArrays {

   public static void sort(int[] x, IntBinaryOperator cmp) {
      sort(x, 0, x.length, cmp);
   }

   public static void sort(int[] x, int off, int len, IntBinaryOperator cmp) {
      sort1(x, off, len, cmp);
   }

   private static void sort1(int x[], int off, int len, IntBinaryOperator cmp) {
      if (len < 7) {
         for (int i=off; i<len+off; i++)
            for (int j=i; j>off && cmp.applyAsInt(x[j-1], x[j]) > 0; j--)
               swap(x, j, j-1);
         return;
      }

      int m = off + (len >> 1);
      if (len > 7) {
         int l = off;
         int n = off + len - 1;
         if (len > 40) {
            int s = len/8;
            l = med3(x, l,     l+s, l+2*s, cmp);
            m = med3(x, m-s,   m,   m+s, cmp);
            n = med3(x, n-2*s, n-s, n, cmp);
         }
         m = med3(x, l, m, n, cmp);
      }
      int v = x[m];

      int a = off, b = a, c = off + len - 1, d = c;
      int r;
      while(true) {
         while (b <= c && (r = cmp.applyAsInt(x[b], v)) <= 0) {
            if (r == 0)
               swap(x, a++, b);
            b++;
         }
         while (c >= b && (r = cmp.applyAsInt(x[c], v)) >= 0) {
            if (r == 0)
               swap(x, c, d--);
            c--;
         }
         if (b > c)
            break;
         swap(x, b++, c--);
      }

      int s, n = off + len;
      s = Math.min(a-off, b-a  );  vecswap(x, off, b-s, s);
      s = Math.min(d-c,   n-d-1);  vecswap(x, b,   n-s, s);

      if ((s = b-a) > 1)
         sort1(x, off, s, cmp);
      if ((s = d-c) > 1)
         sort1(x, n-s, s, cmp);
   }

   /**
    * Lexicographic order, a proper prefix sorting first.
    */
   public static int compare(int[] a, int[] b) {
      int len = Math.min(a.length, b.length);
      for (int i = 0; i < len; ++i) {
         if (a[i] != b[i]) {
            return Integer.compare(a[i], b[i]);
         }
      }
      return Integer.compare(a.length, b.length);
   }

   /**
    * Replaces every value by its rank among the distinct values of the array.
    */
   public static int[] denseRanks(long[] values) {
      int n = values.length;
      int[] order = identity(n);
      sort(order, (i, j) -> {
         int r = Long.compare(values[i], values[j]);
         return r != 0 ? r : Integer.compare(i, j);
      });

      int[] ranks = new int[n];
      int rank = -1;
      for (int i = 0; i < n; ++i) {
         if (i == 0 || values[order[i]] != values[order[i - 1]]) {
            ++rank;
         }
         ranks[order[i]] = rank;
      }
      return ranks;
   }

   public static int[] identity(int n) {
      int[] x = new int[n];
      for (int i = 0; i < n; ++i) x[i] = i;
      return x;
   }

   public static long[] toLongArray(int[] x) {
      long[] result = new long[x.length];
      for (int i = 0; i < x.length; ++i) result[i] = x[i];
      return result;
   }

   public static int countDistinct(int[] labels) {
      if (labels.length == 0) return 0;
      int[] copy = labels.clone();
      Arrays.sort(copy);
      int count = 1;
      for (int i = 1; i < copy.length; ++i) {
         if (copy[i] != copy[i - 1]) ++count;
      }
      return count;
   }

   public static int max(int[] x, int emptyValue) {
      int max = emptyValue;
      for (int i = 0; i < x.length; ++i) {
         if (i == 0 || x[i] > max) max = x[i];
      }
      return max;
   }

   private static void swap(int x[], int a, int b) {
      int t = x[a];
      x[a] = x[b];
      x[b] = t;
   }

   private static void vecswap(int x[], int a, int b, int n) {
      for (int i=0; i<n; i++, a++, b++)
         swap(x, a, b);
   }

   private static int med3(int x[], int a, int b, int c, IntBinaryOperator cmp) {
      return (cmp.applyAsInt(x[a], x[b]) < 0 ?
              (cmp.applyAsInt(x[b], x[c]) < 0 ? b : cmp.applyAsInt(x[a], x[c]) < 0 ? c : a) :
              (cmp.applyAsInt(x[b], x[c]) > 0 ? b : cmp.applyAsInt(x[a], x[c]) > 0 ? c : a));
   }
}
