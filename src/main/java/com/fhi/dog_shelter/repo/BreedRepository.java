package com.fhi.dog_shelter.repo;

import com.fhi.dog_shelter.model.Breed;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface BreedRepository extends JpaRepository<Breed, Long> {

    /**
     * All breed names, in plain ascending order of the name column
     * (the database collation decides ties and case).
     */
    @Query("select b.name from Breed b order by b.name asc")
    List<String> findAllNamesOrderByName();
}
