package com.smallbiz.agent.controller;

import com.smallbiz.agent.component.ResponsePhrases;
import com.smallbiz.agent.dto.TriageResult;
import com.smallbiz.agent.dto.VoiceCallRequest;
import com.smallbiz.agent.entity.ReceptionistConfig;
import com.smallbiz.agent.repository.ReceptionistConfigRepository;
import com.smallbiz.agent.service.CallTriageService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Twilio voice webhooks. Twilio transcribes the caller with {@code <Gather input="speech">} and posts the
 * text back to {@code /gather}; the triage action decides the next TwiML verb.
 */
@RestController
@RequestMapping("/twilio/voice")
public class VoiceController {

    private static final Logger log = LoggerFactory.getLogger(VoiceController.class);

    private static final String VOICE = "Polly.Joanna-Neural";

    @Value("${twilio.base-url:}")
    private String baseUrl;

    private final CallTriageService callTriageService;
    private final ReceptionistConfigRepository configRepository;
    private final ResponsePhrases phrases;

    public VoiceController(CallTriageService callTriageService,
                           ReceptionistConfigRepository configRepository,
                           ResponsePhrases phrases) {
        this.callTriageService = callTriageService;
        this.configRepository = configRepository;
        this.phrases = phrases;
    }

    @PostMapping(value = "/inbound", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> inbound(@RequestParam Long businessId,
                                          @RequestParam(required = false) Map<String, String> params) {
        String greeting = configRepository.findByBusinessId(businessId)
                .map(ReceptionistConfig::getGreeting)
                .filter(StringUtils::isNotBlank)
                .orElse(phrases.continueConversation(null));
        log.info("Inbound call business={} callSid={} from={}", businessId, param(params, "CallSid"), param(params, "From"));
        return ResponseEntity.ok("<Response>" + gather(businessId, greeting) + say(phrases.goodbye()) + "</Response>");
    }

    @PostMapping(value = "/gather", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> gather(@RequestParam Long businessId,
                                         @RequestParam(required = false) Map<String, String> params) {
        String speech = param(params, "SpeechResult");
        if (StringUtils.isBlank(speech)) {
            return ResponseEntity.ok("<Response>" + gather(businessId, phrases.didNotCatch()) + "</Response>");
        }
        VoiceCallRequest request = new VoiceCallRequest(businessId, param(params, "CallSid"), param(params, "From"),
                speech, StringUtils.trimToNull(param(params, "CallerName")));
        TriageResult result = callTriageService.processCall(request);
        return ResponseEntity.ok(toTwiml(businessId, result));
    }

    String toTwiml(Long businessId, TriageResult result) {
        String say = say(result.response());
        switch (result.action()) {
            case TRANSFER_EMERGENCY:
            case TRANSFER_TO_MANAGER:
                if (StringUtils.isNotBlank(result.transferNumber())) {
                    return "<Response>" + say + "<Dial>" + escapeXml(result.transferNumber()) + "</Dial></Response>";
                }
                log.warn("No transfer number configured for business {}; offering voicemail", businessId);
                return "<Response>" + say + record() + "</Response>";
            case TAKE_VOICEMAIL:
                return "<Response>" + say + record() + "</Response>";
            case HANDLE_ERROR:
                return "<Response>" + say + "<Hangup/></Response>";
            default:
                return "<Response>" + gather(businessId, result.response()) + say(phrases.goodbye()) + "</Response>";
        }
    }

    private String gather(Long businessId, String prompt) {
        return "<Gather input=\"speech\" speechTimeout=\"auto\" action=\"" + escapeXml(url("/twilio/voice/gather?businessId=" + businessId))
                + "\" method=\"POST\">" + say(prompt) + "</Gather>";
    }

    private String record() {
        return say(phrases.voicemailPrompt()) + "<Record maxLength=\"120\" playBeep=\"true\"/>";
    }

    private static String say(String text) {
        return "<Say voice=\"" + escapeXml(VOICE) + "\">" + escapeXml(text) + "</Say>";
    }

    private String url(String path) {
        return StringUtils.isNotBlank(baseUrl) ? baseUrl.trim().replaceAll("/$", "") + path : path;
    }

    private static String param(Map<String, String> params, String name) {
        return params != null ? params.getOrDefault(name, "") : "";
    }

    private static String escapeXml(String raw) {
        if (raw == null) return "";
        return raw
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&apos;");
    }
}
