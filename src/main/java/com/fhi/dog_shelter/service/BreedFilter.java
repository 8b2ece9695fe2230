package com.fhi.dog_shelter.service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Breed names parsed from the {@code breeds} query parameter, e.g. {@code "Beagle, Labrador Retriever"}.
 *
 * <p>Parsing never fails. Entries are trimmed, empty ones dropped, duplicates removed
 * (first occurrence wins). When nothing is left, the filter is empty and means "all breeds".</p>
 */
public final class BreedFilter
{
   private static final BreedFilter NONE = new BreedFilter(Collections.emptySet());

   private final Set<String> names;

   private BreedFilter(Set<String> names)
   {  this.names = names;
   }

   /**
    * @param raw the raw parameter value, may be null
    */
   public static BreedFilter parse(String raw)
   {
      if (raw == null || raw.isBlank())
      {  return NONE;
      }

      Set<String> names = new LinkedHashSet<>();
      for (String entry : raw.split(","))
      {  String name = entry.trim();
         if (!name.isEmpty())
         {  names.add(name);
         }
      }
      return names.isEmpty() ? NONE : new BreedFilter(Collections.unmodifiableSet(names));
   }

   public boolean isEmpty()
   {  return names.isEmpty();
   }

   /**
    * Names in the order they were given.
    */
   public Set<String> names()
   {  return names;
   }

   @Override
   public String toString()
   {  return isEmpty() ? "[all breeds]" : names.toString();
   }
}
