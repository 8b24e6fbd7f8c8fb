package com.anxietycompanion.controller;

import com.anxietycompanion.model.domain.CompanionPersona;
import com.anxietycompanion.model.domain.Conversation;
import com.anxietycompanion.model.domain.Language;
import com.anxietycompanion.model.dto.ConversationDto;
import com.anxietycompanion.model.dto.CreateConversationRequest;
import com.anxietycompanion.model.dto.SendMessageRequest;
import com.anxietycompanion.model.dto.SubmissionResponse;
import com.anxietycompanion.service.ConversationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    @PostMapping
    public ResponseEntity<ConversationDto> create(@RequestBody(required = false) CreateConversationRequest body) {
        CompanionPersona persona = CompanionPersona.fromCode(body != null ? body.getPersona() : null);
        Language language = body != null && body.getLanguage() != null
                ? Language.fromCode(body.getLanguage())
                : persona.getDefaultLanguage();
        Conversation conversation = conversationService.startConversation(persona, language);
        return ResponseEntity.status(HttpStatus.CREATED).body(conversationService.toDto(conversation));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ConversationDto> get(@PathVariable UUID id) {
        return ResponseEntity.ok(conversationService.toDto(conversationService.getConversation(id)));
    }

    @PostMapping("/{id}/messages")
    public ResponseEntity<SubmissionResponse> send(@PathVariable UUID id,
                                                   @Valid @RequestBody SendMessageRequest request) {
        return ResponseEntity.accepted()
                .body(new SubmissionResponse(conversationService.submitMessage(id, request.getText())));
    }

    @PostMapping("/{id}/messages/resend")
    public ResponseEntity<SubmissionResponse> resend(@PathVariable UUID id,
                                                     @Valid @RequestBody SendMessageRequest request) {
        return ResponseEntity.accepted()
                .body(new SubmissionResponse(conversationService.resendMessage(id, request.getText())));
    }
}
