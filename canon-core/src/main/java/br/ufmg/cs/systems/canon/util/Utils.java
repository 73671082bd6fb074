package br.ufmg.cs.systems.canon.util;

public class Utils {
   /**
    * Size of the intersection of two ascending arrays.
    */
   public static int sintersectSize(int[] arr1, int[] arr2) {
      int startIdx1 = 0, endIdx1 = arr1.length;
      int startIdx2 = 0, endIdx2 = arr2.length;
      int size = 0;
      while (startIdx1 < endIdx1 && startIdx2 < endIdx2) {
         int v1 = arr1[startIdx1];
         int v2 = arr2[startIdx2];
         if (v1 == v2) {
            ++size;
            ++startIdx1;
            ++startIdx2;
         } else if (v1 < v2) {
            ++startIdx1;
         } else {
            ++startIdx2;
         }
      }

      return size;
   }
}
