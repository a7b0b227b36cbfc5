package io.github.drompincen.javacron.gateway.controller;

import io.github.drompincen.javacron.protocol.api.ConnectionTestResponse;
import io.github.drompincen.javacron.runtime.remote.ConnectionPool;
import io.github.drompincen.javacron.runtime.remote.RemoteTarget;
import io.github.drompincen.javacron.runtime.store.EventStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/servers/{serverId}")
public class ServerController {

    private final EventStore eventStore;
    private final ConnectionPool connectionPool;

    public ServerController(EventStore eventStore, ConnectionPool connectionPool) {
        this.eventStore = eventStore;
        this.connectionPool = connectionPool;
    }

    @PostMapping("/test")
    public ResponseEntity<ConnectionTestResponse> testConnection(@PathVariable String serverId) {
        return eventStore.findServer(serverId)
                .map(server -> ResponseEntity.ok(connectionPool.testConnection(RemoteTarget.forServer(server))))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/prompt")
    public ResponseEntity<Map<String, String>> prompt(@PathVariable String serverId,
                                                      @RequestParam(required = false) String cwd) {
        var server = eventStore.findServer(serverId);
        if (server.isEmpty()) return ResponseEntity.notFound().build();
        String prompt = connectionPool.shellPrompt(RemoteTarget.forServer(server.get()), cwd);
        return ResponseEntity.ok(Map.of("prompt", prompt));
    }

    @PostMapping("/prewarm")
    public ResponseEntity<Void> prewarm(@PathVariable String serverId) {
        var server = eventStore.findServer(serverId);
        if (server.isEmpty()) return ResponseEntity.notFound().build();
        connectionPool.prewarm(RemoteTarget.forServer(server.get()));
        return ResponseEntity.accepted().build();
    }
}
