package docbuild.demo.starter;

import docbuild.DocBuild;
import docbuild.model.BuildAttempt;
import docbuild.model.QueueEntry;
import docbuild.registry.WebhookSignatureVerifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class BuildController {

    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";

    private static final Logger log = LoggerFactory.getLogger(BuildController.class);

    private final DocBuild docBuild;
    private final WebhookSignatureVerifier verifier;

    public BuildController(DocBuild docBuild, ObjectProvider<WebhookSignatureVerifier> verifier) {
        this.docBuild = docBuild;
        this.verifier = verifier.getIfAvailable();
    }

    @PostMapping("/webhooks/registry")
    public ResponseEntity<Map<String, Object>> registryActivity(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature
    ) {
        byte[] payload = body == null ? new byte[0] : body;
        if (verifier != null && !verifier.verify(payload, signature)) {
            log.warn("Rejected registry webhook with a bad signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("status", "rejected"));
        }
        boolean triggered = docBuild.notifyRegistryActivity();
        log.info("Registry webhook received, sync triggered={}", triggered);
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "triggered", triggered));
    }

    @GetMapping("/releases/{name}/{version}/status")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String name, @PathVariable String version) {
        return docBuild.queries().releaseStatus(name, version)
                .map(status -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("name", name);
                    body.put("version", version);
                    body.put("status", status.status().name().toLowerCase());
                    body.put("lastBuildTime", String.valueOf(status.lastBuildTime()));
                    body.put("queued", docBuild.queries().isQueued(name, version));
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/releases/{name}/{version}/builds")
    public List<BuildAttempt> builds(@PathVariable String name, @PathVariable String version) {
        return docBuild.queries().builds(name, version);
    }

    @GetMapping("/queue")
    public List<QueueEntry> queue() {
        return docBuild.queries().queue();
    }
}
