package com.musicgroups.controller;

import com.musicgroups.config.MusicGroupsConfig;
import com.musicgroups.service.SeedService;
import com.musicgroups.service.SeedService.SeedInfo;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/seed")
public class SeedApiController {

    private final SeedService seedService;
    private final MusicGroupsConfig config;

    public SeedApiController(SeedService seedService, MusicGroupsConfig config) {
        this.seedService = seedService;
        this.config = config;
    }

    @GetMapping
    public ResponseEntity<SeedInfo> info() {
        return ResponseEntity.ok(seedService.info());
    }

    @PostMapping
    public ResponseEntity<SeedInfo> seed(@RequestParam(required = false) Integer count,
                                         @RequestParam(defaultValue = "true") boolean removeSeeds) {
        int nrToSeed = count != null ? count : config.getDefaultSeedCount();
        if (nrToSeed < 0) {
            throw new IllegalArgumentException("count must not be negative: " + nrToSeed);
        }
        if (removeSeeds) {
            seedService.removeSeeds(true);
        }
        return ResponseEntity.ok(seedService.seed(nrToSeed));
    }
}
