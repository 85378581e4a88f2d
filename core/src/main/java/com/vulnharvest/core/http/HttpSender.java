package com.vulnharvest.core.http;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/** 송신 훅: 프로덕션은 HttpClient, 테스트는 람다로 응답을 꾸민다 */
@FunctionalInterface
public interface HttpSender {
    HttpResponse<String> send(HttpRequest req) throws Exception;

    static HttpSender of(HttpClient client) {
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }
}
