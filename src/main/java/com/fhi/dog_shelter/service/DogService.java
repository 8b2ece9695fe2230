package com.fhi.dog_shelter.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.dog_shelter.dto.DogDetailDto;
import com.fhi.dog_shelter.dto.DogSummaryDto;
import com.fhi.dog_shelter.model.Dog;
import com.fhi.dog_shelter.repo.DogRepository;
import com.fhi.dog_shelter.service.exception.dog.DogNotFoundException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read side of the dog listing.
 *
 * Each public method runs in its own read-only transaction: a connection is taken from
 * the pool when the method is entered and handed back on every exit path, including
 * the not-found one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class DogService
{
   private final DogRepository dogRepository;


   /**
    * Lists dogs, optionally restricted to a set of breeds.
    *
    * @param filter breed names to keep; an empty filter keeps every dog
    * @return id, name and breed name of each matching dog, by ascending id
    */
   public List<DogSummaryDto> listDogs(BreedFilter filter)
   {
      log.debug("filter = {}", filter);

      List<DogSummaryDto> dogs = filter.isEmpty()
                               ? dogRepository.findAllSummaries()
                               : dogRepository.findSummariesByBreedNames(filter.names());

      log.debug("{} dog(s) found", dogs.size());
      return dogs;
   }


   /**
    * @throws DogNotFoundException if no dog has this id
    */
   public DogDetailDto getDog(Long id)
   {
      log.debug("id = {}", id);
      Dog dog = dogRepository.findWithBreedById(id)
                             .orElseThrow(() -> DogNotFoundException.forId(id));
      return toDetail(dog);
   }


   private DogDetailDto toDetail(Dog dog)
   {
      DogDetailDto dto = new DogDetailDto();
      dto.setId         (dog.getId());
      dto.setName       (dog.getName());
      dto.setBreed      (dog.getBreed().getName());
      dto.setAge        (dog.getAge());
      dto.setDescription(dog.getDescription());
      dto.setGender     (dog.getGender() != null ? dog.getGender().getLabel() : null);
      dto.setStatus     (dog.getStatus().getLabel());
      return dto;
   }
}
