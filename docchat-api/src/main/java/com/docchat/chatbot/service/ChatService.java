package com.docchat.chatbot.service;

import com.docchat.chatbot.model.Answer;
import reactor.core.publisher.Mono;

public interface ChatService {

    /**
     * Embeds the query, retrieves matching chunks and synthesizes a grounded answer.
     */
    Mono<Answer> answer(String query);
}
