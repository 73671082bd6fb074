package br.ufmg.cs.systems.canon.util;

import java.lang.reflect.InvocationTargetException;

public class ReflectionUtils {

   public static <T> T newInstance(Class<T> clazz) {
      T object = null;
      try {
         object = clazz.getDeclaredConstructor().newInstance();
      } catch (InstantiationException | IllegalAccessException |
              NoSuchMethodException | InvocationTargetException e) {
         throw new RuntimeException(e + " " + clazz, e);
      }
      return object;
   }

   @SuppressWarnings("unchecked")
   public static <T> Class<? extends T> classFor(String className,
                                                 Class<T> expected) {
      Class<?> clazz;
      try {
         clazz = Class.forName(className);
      } catch (ClassNotFoundException e) {
         throw new RuntimeException(e);
      }

      if (!expected.isAssignableFrom(clazz)) {
         throw new IllegalArgumentException(className + " is not a " +
                 expected.getName());
      }

      return (Class<? extends T>) clazz;
   }
}
