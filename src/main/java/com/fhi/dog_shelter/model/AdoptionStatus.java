package com.fhi.dog_shelter.model;

/**
 * Where a dog stands in the adoption process.
 *
 * <p>The label is what the API returns in the {@code status} field. Clients match on
 * these exact upper-case strings, so a label must not change when a constant is renamed.
 */
public enum AdoptionStatus
{
    AVAILABLE("AVAILABLE"),
    PENDING  ("PENDING"),
    ADOPTED  ("ADOPTED");

   private final String label;

   AdoptionStatus(String label)
   {  this.label = label;
   }

   public String getLabel()
   {  return label;
   }
}
