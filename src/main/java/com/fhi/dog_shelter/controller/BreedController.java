package com.fhi.dog_shelter.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.dog_shelter.service.BreedService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/breeds")
@RequiredArgsConstructor
public class BreedController
{
    private final BreedService breedService;

    @GetMapping
    public ResponseEntity<List<String>> getBreeds()
    {
        return ResponseEntity.ok(breedService.listBreedNames());
    }
}
