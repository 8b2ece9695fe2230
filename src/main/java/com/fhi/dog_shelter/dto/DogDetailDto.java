package com.fhi.dog_shelter.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

@Data
@JsonPropertyOrder({ "id", "name", "breed", "age", "description", "gender", "status" })
public class DogDetailDto {

    private Long id;
    private String name;
    private String breed;
    private Integer age;
    private String description;
    private String gender;       // e.g. "Male"
    private String status;       // e.g. "AVAILABLE"
}
