package ch.so.arp.recall.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoints exposing conversation exchanges and transport replies.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class ExchangeController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExchangeController.class);

    private final OrchestratorRegistry orchestratorRegistry;

    public ExchangeController(OrchestratorRegistry orchestratorRegistry) {
        this.orchestratorRegistry = orchestratorRegistry;
    }

    @PostMapping(path = "/exchange", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ExchangeReply exchange(@Valid @RequestBody ExchangeRequest request) {
        ExchangeOrchestrator orchestrator = orchestratorRegistry.forCollection(SourceKind.HISTORY,
                request.collection());
        LOGGER.debug("Exchange {}/{} on {}", request.responseMode(), request.retrievalMode(),
                orchestrator.collectionName());
        return new ExchangeReply(orchestrator.exchange(request.responseMode(), request.retrievalMode(),
                request.query(), request.prompt()));
    }

    @PostMapping(path = "/transport/{collection}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ExchangeReply transport(@PathVariable String collection, @Valid @RequestBody TransportRequest request) {
        ExchangeOrchestrator orchestrator = orchestratorRegistry.forCollection(SourceKind.DISCORD, collection);
        return new ExchangeReply(orchestrator.transportExchange(request.message(), request.prompt()));
    }
}
