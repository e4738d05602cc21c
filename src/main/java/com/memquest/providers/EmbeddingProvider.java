package com.memquest.providers;

import java.util.List;

public interface EmbeddingProvider {

    /**
     * One vector per input text, in input order.
     *
     * @throws Exception on transport or API failure; callers decide whether to retry
     */
    List<float[]> embed(List<String> texts) throws Exception;
}
