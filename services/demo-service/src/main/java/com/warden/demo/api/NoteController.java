package com.warden.demo.api;

import com.warden.demo.domain.Note;
import com.warden.demo.infrastructure.jdbc.NoteRepository;
import com.warden.guard.web.RequireOwnership;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Notes API; every endpoint requires the caller to own the note. */
@RestController
@RequestMapping("/notes")
@RequireOwnership(resource = Note.class)
public class NoteController {

    private final NoteRepository notes;

    public NoteController(NoteRepository notes) {
        this.notes = notes;
    }

    @GetMapping("/{id}")
    public ResponseEntity<Note> get(@PathVariable("id") UUID id) {
        return ResponseEntity.of(notes.findById(id));
    }
}
