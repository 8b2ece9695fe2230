package com.fhi.dog_shelter.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.dog_shelter.dto.DogDetailDto;
import com.fhi.dog_shelter.dto.DogSummaryDto;
import com.fhi.dog_shelter.service.BreedFilter;
import com.fhi.dog_shelter.service.DogService;

import lombok.RequiredArgsConstructor;


@RestController
@RequestMapping("/api/dogs")
@RequiredArgsConstructor
public class DogController
{
    private final DogService dogService;

   /**
    * Lists dogs, optionally only those of the given breeds.
    *
    * Example: GET /api/dogs?breeds=Beagle,Labrador%20Retriever
    */
    @GetMapping
    public ResponseEntity<List<DogSummaryDto>> getDogs(@RequestParam(name = "breeds", required = false) String breeds)
    {
        return ResponseEntity.ok(dogService.listDogs(BreedFilter.parse(breeds)));
    }

    // Digits only: anything else matches no handler and ends up as a 404.
    @GetMapping("/{id:\\d+}")
    public ResponseEntity<DogDetailDto> getDogById(@PathVariable Long id)
    {
        return ResponseEntity.ok(dogService.getDog(id));
    }
}
