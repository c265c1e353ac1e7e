package app.twodots.core.resolution.controller;

import app.twodots.core.resolution.domain.CacheStats;
import app.twodots.core.resolution.domain.NodeCardData;
import app.twodots.core.resolution.domain.NodeCardMapping;
import app.twodots.core.resolution.domain.NodeReference;
import app.twodots.core.resolution.service.NodeResolutionService;
import app.twodots.core.security.CurrentUserProvider;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/nodes")
public class NodeResolutionController {

    private final CurrentUserProvider currentUserProvider;
    private final NodeResolutionService nodeResolutionService;

    public NodeResolutionController(CurrentUserProvider currentUserProvider,
                                    NodeResolutionService nodeResolutionService) {
        this.currentUserProvider = currentUserProvider;
        this.nodeResolutionService = nodeResolutionService;
    }

    // POST /nodes/resolve
    @PostMapping("/resolve")
    public NodeCardData resolveNode(
            @AuthenticationPrincipal Jwt jwt,
            @RequestBody NodeReference node
    ) {
        requireNodeId(node);
        var userId = currentUserProvider.getUserId(jwt);
        return nodeResolutionService.resolveNode(userId, node);
    }

    // POST /nodes/map
    @PostMapping("/map")
    public NodeCardMapping mapNode(
            @AuthenticationPrincipal Jwt jwt,
            @RequestBody NodeReference node
    ) {
        requireNodeId(node);
        var userId = currentUserProvider.getUserId(jwt);
        return nodeResolutionService.mapNode(userId, node)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No card for node " + node.id()));
    }

    // DELETE /nodes/cache
    @DeleteMapping("/cache")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearCache(@AuthenticationPrincipal Jwt jwt) {
        var userId = currentUserProvider.getUserId(jwt);
        nodeResolutionService.clearCache(userId);
    }

    // GET /nodes/cache/stats
    @GetMapping("/cache/stats")
    public CacheStats cacheStats(@AuthenticationPrincipal Jwt jwt) {
        var userId = currentUserProvider.getUserId(jwt);
        return nodeResolutionService.cacheStats(userId);
    }

    private static void requireNodeId(NodeReference node) {
        if (node == null || node.id() == null || node.id().isBlank()) {
            throw new IllegalArgumentException("Node id is required");
        }
    }
}
