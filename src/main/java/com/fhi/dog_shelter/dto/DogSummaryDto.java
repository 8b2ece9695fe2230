package com.fhi.dog_shelter.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the dog listing.
 *
 * Built directly by a JPQL constructor expression, see DogRepository.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "id", "name", "breed" })
public class DogSummaryDto {

    private Long id;
    private String name;
    private String breed;        // breed name, not id
}
