package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.ArchivalMemoryRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.CoreMemoryUpdateRequest;
import me.golemcore.gateway.domain.model.CoreMemoryBlock;
import me.golemcore.gateway.domain.model.MemoryRecord;
import me.golemcore.gateway.domain.model.MemoryStats;
import me.golemcore.gateway.port.outbound.MemoryPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Archival and core memory endpoints.
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryPort memoryPort;

    /**
     * Searches archival memory when {@code q} is given, otherwise lists current
     * records newest first.
     */
    @GetMapping("/archival")
    public Mono<ResponseEntity<List<MemoryRecord>>> listArchival(
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "0") int limit,
            @RequestParam(defaultValue = "false") boolean includeHistory) {
        return Mono.fromCallable(() -> {
            List<MemoryRecord> records;
            if (q == null || q.isBlank()) {
                records = memoryPort.listCurrent(limit);
            } else if (includeHistory) {
                records = memoryPort.searchIncludingHistory(q, limit);
            } else {
                records = memoryPort.search(q, limit);
            }
            return ResponseEntity.ok(records);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/archival/{id}")
    public Mono<ResponseEntity<MemoryRecord>> getArchival(@PathVariable long id) {
        return Mono.fromCallable(() -> memoryPort.get(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Memory record not found")))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/archival/{id}/history")
    public Mono<ResponseEntity<List<MemoryRecord>>> getHistory(@PathVariable long id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryPort.history(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/archival")
    public Mono<ResponseEntity<MemoryRecord>> saveArchival(@RequestBody ArchivalMemoryRequest request) {
        requireText(request.getText());
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(memoryPort.save(request.getText(), request.getTags())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/archival/{id}")
    public Mono<ResponseEntity<MemoryRecord>> updateArchival(@PathVariable long id,
            @RequestBody ArchivalMemoryRequest request) {
        requireText(request.getText());
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryPort.update(id, request.getText(), request.getTags())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/core")
    public Mono<ResponseEntity<List<CoreMemoryBlock>>> listCore() {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryPort.getCoreBlocks()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/core/{name}")
    public Mono<ResponseEntity<CoreMemoryBlock>> getCore(@PathVariable String name) {
        return Mono.fromCallable(() -> memoryPort.getCoreBlock(name)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Core block not found")))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/core/{name}")
    public Mono<ResponseEntity<CoreMemoryBlock>> replaceCore(@PathVariable String name,
            @RequestBody CoreMemoryUpdateRequest request) {
        if (request.getContent() == null) {
            throw new IllegalArgumentException("'content' is required");
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryPort.replaceCoreBlock(name, request.getContent())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<MemoryStats>> stats() {
        return Mono.fromCallable(() -> ResponseEntity.ok(memoryPort.stats()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("'text' is required");
        }
    }
}
