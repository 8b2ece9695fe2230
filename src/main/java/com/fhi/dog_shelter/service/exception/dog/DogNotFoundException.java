package com.fhi.dog_shelter.service.exception.dog;

/**
 * Thrown when a dog looked up by id does not exist.
 *
 * <p>The message is the one shown to API clients, so it carries no id.
 * The id is kept in {@link #getDogId()} for logs.</p>
 */
public class DogNotFoundException extends RuntimeException
{
   public static final String MESSAGE = "Dog not found";

   private final Long dogId;

   public DogNotFoundException(Long dogId)
   {  super(MESSAGE);
      this.dogId = dogId;
   }

   public Long getDogId()
   {  return dogId;
   }


   /**
    * Returns the exception name, message and the id that was looked up, e.g.
    * <pre>
    * DogNotFoundException: Dog not found (id=42)
    * </pre>
    */
   @Override
   public String toString()
   {  return String.format("%s: %s (id=%d)", getClass().getSimpleName(), getMessage(), dogId);
   }


    // -----------------------------------------
    // Static factory methods
    // -----------------------------------------

   public static DogNotFoundException forId(Long dogId)
   {  return new DogNotFoundException(dogId);
   }
}
