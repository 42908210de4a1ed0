package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

import java.util.Set;

public class UnexpectedKeyParameterException extends KeyTemplateException {

    private final Set<String> parameters;

    public UnexpectedKeyParameterException(String template, Set<String> parameters) {
        super("Unexpected parameters " + parameters + " for lock key " + template);
        this.parameters = Set.copyOf(parameters);
    }

    public Set<String> getParameters() {
        return parameters;
    }
}
