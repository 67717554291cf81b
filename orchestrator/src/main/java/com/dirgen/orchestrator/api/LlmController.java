package com.dirgen.orchestrator.api;

import com.dirgen.orchestrator.api.dto.AskRequest;
import com.dirgen.orchestrator.api.dto.AskResponse;
import com.dirgen.orchestrator.llm.ProviderFailoverEngine;
import com.dirgen.orchestrator.llm.TaskClass;
import com.dirgen.orchestrator.llm.credential.CredentialPool;
import com.dirgen.orchestrator.llm.credential.CredentialPools;
import com.dirgen.orchestrator.llm.credential.CredentialStats;
import com.dirgen.orchestrator.llm.local.LocalModelManager;
import com.dirgen.orchestrator.model.ProtocolException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * The LLM resilience layer, exposed so workers in any language share one
 * failover engine, cache and set of credential pools.
 *
 * POST /llm/ask                          : failover-protected completion
 * GET  /llm/models                       : managed local models
 * POST /llm/models/ensure?backendId=     : start a local model now
 * POST /llm/models/sweep                 : run the idle sweep now
 * GET  /llm/credentials                  : per-provider key statistics
 * POST /llm/credentials/{provider}/reset : clear cooldowns of one provider
 */
@RestController
@RequestMapping("/llm")
public class LlmController {

    private final ProviderFailoverEngine engine;
    private final LocalModelManager      localModels;
    private final CredentialPools        credentials;

    public LlmController(ProviderFailoverEngine engine,
                         LocalModelManager localModels,
                         CredentialPools credentials) {
        this.engine      = engine;
        this.localModels = localModels;
        this.credentials = credentials;
    }

    /** 502 if every provider failed. */
    @PostMapping("/ask")
    public AskResponse ask(@RequestBody AskRequest req) {
        if (req.userPrompt() == null || req.userPrompt().isBlank()) {
            throw new ProtocolException("Field 'userPrompt' is required");
        }
        TaskClass taskClass = TaskClass.fromWire(req.taskClass());
        String text = engine.ask(req.modelId(), req.systemPrompt(), req.userPrompt(), taskClass, req.useCache());
        return new AskResponse(text);
    }

    @GetMapping("/models")
    public LocalModelManager.Status models() {
        return localModels.status();
    }

    @PostMapping("/models/ensure")
    public Map<String, Object> ensure(@RequestParam String backendId) {
        boolean running = localModels.ensureRunning(backendId);
        return Map.of("backendId", backendId, "running", running);
    }

    @PostMapping("/models/sweep")
    public Map<String, Object> sweep() {
        return Map.of("evicted", localModels.evictIdle());
    }

    @GetMapping("/credentials")
    public List<CredentialStats> credentialStats() {
        return credentials.stats();
    }

    @PostMapping("/credentials/{provider}/reset")
    public CredentialStats resetCredentials(@PathVariable String provider) {
        CredentialPool pool = credentials.get(provider).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "No credential pool for provider: " + provider));
        pool.reset();
        return pool.stats();
    }
}
