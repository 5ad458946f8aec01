package com.musicgroups.controller;

import com.musicgroups.edit.ChildKind;
import com.musicgroups.edit.EditOutcome;
import com.musicgroups.edit.GroupSaveService;
import com.musicgroups.edit.GroupStagingService;
import com.musicgroups.edit.MusicGroupInput;
import com.musicgroups.edit.SaveResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.UUID;

/**
 * Round trips of the group edit form. The client posts its whole working copy with every
 * action and gets the updated copy back; only save writes to storage.
 */
@RestController
@RequestMapping("/api/groups/edit")
public class GroupEditController {

    private final GroupStagingService stagingService;
    private final GroupSaveService saveService;

    public GroupEditController(GroupStagingService stagingService, GroupSaveService saveService) {
        this.stagingService = stagingService;
        this.saveService = saveService;
    }

    @GetMapping("/new")
    public ResponseEntity<MusicGroupInput> newGroup() {
        return ResponseEntity.ok(saveService.openNew());
    }

    @GetMapping("/{id}")
    public ResponseEntity<MusicGroupInput> editGroup(@PathVariable UUID id) {
        return ResponseEntity.ok(saveService.open(id));
    }

    @PostMapping("/{kind}")
    public ResponseEntity<EditOutcome> addChild(@PathVariable String kind, @RequestBody MusicGroupInput input) {
        return respond(stagingService.stageInsertChild(input, ChildKind.fromSegment(kind)));
    }

    @PostMapping("/{kind}/{rowId}/delete")
    public ResponseEntity<EditOutcome> deleteChild(@PathVariable String kind,
                                                   @PathVariable UUID rowId,
                                                   @RequestBody MusicGroupInput input) {
        return respond(stagingService.stageDeleteChild(input, ChildKind.fromSegment(kind), rowId));
    }

    @PostMapping("/{kind}/{rowId}/edit")
    public ResponseEntity<EditOutcome> editChild(@PathVariable String kind,
                                                 @PathVariable UUID rowId,
                                                 @RequestBody MusicGroupInput input) {
        return respond(stagingService.stageEditChild(input, ChildKind.fromSegment(kind), rowId));
    }

    @PostMapping("/undo")
    public ResponseEntity<MusicGroupInput> undo(@RequestBody MusicGroupInput input) {
        return ResponseEntity.ok(saveService.undo(input.getGroupId()));
    }

    @PostMapping("/save")
    public ResponseEntity<?> save(@RequestBody MusicGroupInput input) {
        SaveResult result = saveService.save(input);
        if (result instanceof SaveResult.Saved saved) {
            // Both insert and edit cycles continue with the view of the saved group
            URI view = URI.create("/api/groups/" + saved.groupId());
            HttpStatus status = saved.created() ? HttpStatus.CREATED : HttpStatus.OK;
            return ResponseEntity.status(status).location(view).body(saved);
        }
        SaveResult.Invalid invalid = (SaveResult.Invalid) result;
        return ResponseEntity.unprocessableEntity().body(EditOutcome.rejected(input, invalid.validation()));
    }

    private static ResponseEntity<EditOutcome> respond(EditOutcome outcome) {
        if (outcome.validation().isValid()) {
            return ResponseEntity.ok(outcome);
        }
        return ResponseEntity.unprocessableEntity().body(outcome);
    }
}
