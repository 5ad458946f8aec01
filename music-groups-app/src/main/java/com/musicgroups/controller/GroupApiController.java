package com.musicgroups.controller;

import com.musicgroups.config.MusicGroupsConfig;
import com.musicgroups.model.MusicGroup;
import com.musicgroups.model.PageResult;
import com.musicgroups.service.MusicGroupsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/groups")
public class GroupApiController {

    private final MusicGroupsService groups;
    private final MusicGroupsConfig config;

    public GroupApiController(MusicGroupsService groups, MusicGroupsConfig config) {
        this.groups = groups;
        this.config = config;
    }

    @GetMapping
    public ResponseEntity<PageResult<MusicGroup>> listGroups(
            @RequestParam(required = false) Boolean seeded,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page) {
        return ResponseEntity.ok(groups.readMusicGroups(seeded, search, page, config.getPageSize()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<MusicGroup> viewGroup(@PathVariable UUID id) {
        return ResponseEntity.ok(groups.readMusicGroupAggregate(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteGroup(@PathVariable UUID id) {
        groups.delete(id);
        return ResponseEntity.noContent().build();
    }
}
