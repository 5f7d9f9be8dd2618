package com.callinsight.processing.controller;

import com.callinsight.common.exception.UnauthorizedException;
import com.callinsight.config.AppProperties;
import com.callinsight.processing.dto.WebhookResponse;
import com.callinsight.processing.service.CallEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/v1/webhook")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final CallEventHandler callEventHandler;
    private final AppProperties appProperties;

    public WebhookController(CallEventHandler callEventHandler, AppProperties appProperties) {
        this.callEventHandler = callEventHandler;
        this.appProperties = appProperties;
    }

    @PostMapping
    public WebhookResponse receive(@RequestBody Map<String, Object> payload,
                                   @RequestParam(value = "token", required = false) String token,
                                   @RequestHeader(value = "X-Webhook-Token", required = false) String headerToken) {
        verifyToken(token != null ? token : headerToken);
        return new WebhookResponse("ok", callEventHandler.handle(payload));
    }

    @PostMapping("/cdr")
    public WebhookResponse receiveCdr(@RequestBody Map<String, Object> payload,
                                      @RequestParam(value = "token", required = false) String token,
                                      @RequestHeader(value = "X-Webhook-Token", required = false) String headerToken) {
        verifyToken(token != null ? token : headerToken);
        Map<String, Object> event = new LinkedHashMap<>(payload);
        event.put("event", CallEventHandler.NEW_CDR);
        return new WebhookResponse("ok", callEventHandler.handle(event));
    }

    private void verifyToken(String provided) {
        String expected = appProperties.pbx().webhookToken();
        if (expected == null || expected.isBlank()) {
            return;
        }
        if (!expected.equals(provided)) {
            log.warn("Rejected webhook call with an invalid token");
            throw new UnauthorizedException("Invalid webhook token");
        }
    }
}
