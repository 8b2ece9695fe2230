package com.fhi.dog_shelter.service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.dog_shelter.dto.SitemapDto;
import com.fhi.dog_shelter.repo.DogRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class SitemapService
{
   private final DogRepository dogRepository;
   private final Clock clock;


   /**
    * Ids of all dogs (ascending), stamped with the current time to the second.
    */
   @Transactional(readOnly = true)
   public SitemapDto getSitemapData()
   {
      List<Long> ids = dogRepository.findAllIds();
      Instant now = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
      log.debug("{} dog page(s) as of {}", ids.size(), now);
      return new SitemapDto(ids, now);
   }
}
