package com.warden.demo.api;

import com.warden.demo.domain.Document;
import com.warden.demo.domain.DocumentUpdate;
import com.warden.demo.infrastructure.jdbc.DocumentRepository;
import com.warden.guard.web.ClaimsResolver;
import com.warden.guard.web.OwnershipGuardProperties;
import com.warden.guard.web.RequireOwnership;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Documents API. Single-document endpoints require the caller to own the document within their
 * tenant; the listing is scoped to the caller's own documents in their tenant.
 */
@RestController
@RequestMapping("/documents")
public class DocumentController {

    private final DocumentRepository documents;
    private final ClaimsResolver claims;
    private final OwnershipGuardProperties guardProperties;

    public DocumentController(
            DocumentRepository documents, ClaimsResolver claims, OwnershipGuardProperties guardProperties) {
        this.documents = documents;
        this.claims = claims;
        this.guardProperties = guardProperties;
    }

    @GetMapping
    public List<Document> list(HttpServletRequest request) {
        String userId = requireClaim(request, guardProperties.userIdClaim());
        String tenantId = requireClaim(request, guardProperties.tenantIdClaim());
        return documents.findOwnedInTenant(userId, tenantId);
    }

    @GetMapping("/{id}")
    @RequireOwnership(resource = Document.class)
    public ResponseEntity<Document> get(@PathVariable("id") UUID id) {
        return ResponseEntity.of(documents.findById(id));
    }

    @PutMapping("/{id}")
    @RequireOwnership(resource = Document.class)
    public ResponseEntity<Document> update(@PathVariable("id") UUID id, @Valid @RequestBody DocumentUpdate input) {
        Optional<Document> current = documents.findById(id);
        if (current.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Document updated = current.get().apply(input);
        documents.update(updated);
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{id}")
    @RequireOwnership(resource = Document.class)
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        return documents.delete(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private String requireClaim(HttpServletRequest request, String claimType) {
        return claims.resolve(request, claimType)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing claim " + claimType));
    }
}
