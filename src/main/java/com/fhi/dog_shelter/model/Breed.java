package com.fhi.dog_shelter.model;

import org.hibernate.annotations.NaturalId;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;


/**
 * Reference data naming a dog breed.
 *
 * Breeds are created when the database is seeded and are never modified by the API.
 * Identifiers are assigned by the seed, not generated.
 */
@Entity
@Table(name = "breed")
@Getter
@Setter
public class Breed
{
    @Id
    private Long id;

    /**
     * Business key, e.g. "Labrador Retriever".
     *
     * Also what clients filter on, so lookups and joins on the name are exact
     * (case-sensitive) matches.
     */
    @NotBlank
    @Size(max = 100)
    @NaturalId
    @Column(nullable = false, unique = true, length = 100)
    private String name;


   @Override
   public String toString()
   {   return name;
   }
}
