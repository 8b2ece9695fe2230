package com.fhi.dog_shelter.model;

public enum Gender
{
    MALE  ("Male"),
    FEMALE("Female");

   private final String label;

   Gender(String label)
   {  this.label = label;
   }

   /**
    * What the API shows to clients.
    */
   public String getLabel()
   {  return label;
   }
}
