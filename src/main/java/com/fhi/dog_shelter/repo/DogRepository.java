package com.fhi.dog_shelter.repo;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.fhi.dog_shelter.dto.DogSummaryDto;
import com.fhi.dog_shelter.model.Dog;

public interface DogRepository extends JpaRepository<Dog, Long>
{
    @Query("select new com.fhi.dog_shelter.dto.DogSummaryDto(d.id, d.name, b.name) " +
           "from Dog d join d.breed b " +
           "order by d.id")
    List<DogSummaryDto> findAllSummaries();

    /**
     * Dogs whose breed name is one of {@code breedNames}. Exact match, not substring.
     * The collection is bound as a parameter, never spliced into the query.
     *
     * @param breedNames must not be empty
     */
    @Query("select new com.fhi.dog_shelter.dto.DogSummaryDto(d.id, d.name, b.name) " +
           "from Dog d join d.breed b " +
           "where b.name in :breedNames " +
           "order by d.id")
    List<DogSummaryDto> findSummariesByBreedNames(@Param("breedNames") Collection<String> breedNames);

    /**
     * Loads a dog with its breed in one select.
     */
    @Query("select d from Dog d join fetch d.breed where d.id = :id")
    Optional<Dog> findWithBreedById(@Param("id") Long id);

    @Query("select d.id from Dog d order by d.id")
    List<Long> findAllIds();
}
