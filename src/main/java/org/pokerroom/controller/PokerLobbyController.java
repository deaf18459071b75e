package org.pokerroom.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.pokerroom.dto.poker.CreateTableReq;
import org.pokerroom.dto.poker.TableSummary;
import org.pokerroom.dto.poker.TableView;
import org.pokerroom.model.poker.rules.ValidAction;
import org.pokerroom.service.PokerTableService;
import org.pokerroom.service.poker.analysis.HandStrength;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.security.Principal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/poker")
@RequiredArgsConstructor
public class PokerLobbyController {

    private final PokerTableService service;

    @GetMapping("/tables")
    public List<TableSummary> list() {
        return service.listTables();
    }

    @PostMapping("/table")
    public ResponseEntity<?> create(@Valid @RequestBody CreateTableReq req) {
        try {
            return ResponseEntity.ok(service.createTable(req));
        } catch (IllegalArgumentException iae) {
            return ResponseEntity.badRequest().body(Map.of("error", iae.getMessage()));
        }
    }

    /** Anonymous callers get the public view: no hole cards before showdown. */
    @GetMapping("/table/{id}/view")
    public TableView view(@PathVariable Long id, Principal principal) {
        return service.view(id, principal == null ? null : principal.getName());
    }

    @GetMapping("/table/{id}/actions")
    public List<ValidAction> actions(@PathVariable Long id, @RequestParam int seat) {
        return service.validActions(id, seat);
    }

    @GetMapping("/table/{id}/strength")
    public HandStrength strength(@PathVariable Long id, Principal principal) {
        if (principal == null) throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Joueur non identifié");
        return service.strength(id, principal.getName());
    }

    @DeleteMapping("/table/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        service.deleteTable(id);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> unknown(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> conflict(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", ex.getMessage()));
    }
}
