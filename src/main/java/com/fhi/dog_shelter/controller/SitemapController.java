package com.fhi.dog_shelter.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.dog_shelter.dto.SitemapDto;
import com.fhi.dog_shelter.service.SitemapService;

@RestController
@RequestMapping("/api/sitemap")
public class SitemapController {

   private final SitemapService sitemapService;

   // Constructor autowiring
   public SitemapController(SitemapService sitemapService)
   {
      this.sitemapService = sitemapService;
   }

    @GetMapping
    public ResponseEntity<SitemapDto> getSitemapData() {
        return ResponseEntity.ok(sitemapService.getSitemapData());
    }
}
