package com.fhi.dog_shelter.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.dog_shelter.repo.BreedRepository;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class BreedService
{
    private final BreedRepository breedRepository;

    /**
     * Names always offered after the stored breeds, for dogs whose breed is mixed or not known.
     */
    private final List<String> sentinelNames;


    public BreedService(BreedRepository breedRepository,
                        @Value("${dog-shelter.breeds.sentinels:Mixed Breed,Unknown}") List<String> sentinelNames)
    {   this.breedRepository = breedRepository;
        this.sentinelNames   = sentinelNames.stream()
                                            .map(String::trim)
                                            .filter(name -> !name.isEmpty())
                                            .toList();
    }


    /**
     * Stored breed names in ascending order, followed by the sentinel names in configured order.
     * A sentinel that is also a stored breed keeps its sorted position and is not repeated.
     */
    @Transactional(readOnly = true)
    public List<String> listBreedNames()
    {
        List<String> stored = breedRepository.findAllNamesOrderByName();
        log.debug("{} stored breed(s)", stored.size());

        Set<String> names = new LinkedHashSet<>(stored);
        names.addAll(sentinelNames);
        return new ArrayList<>(names);
    }

    public List<String> getSentinelNames()
    {   return sentinelNames;
    }
}
