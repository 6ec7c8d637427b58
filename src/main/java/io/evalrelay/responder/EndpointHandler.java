package io.evalrelay.responder;

@FunctionalInterface
public interface EndpointHandler<Q, R> {
    R handle(Q request) throws Exception;
}
