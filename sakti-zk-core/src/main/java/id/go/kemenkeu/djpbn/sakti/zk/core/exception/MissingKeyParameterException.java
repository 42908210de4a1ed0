package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

public class MissingKeyParameterException extends KeyTemplateException {

    private final String parameter;

    public MissingKeyParameterException(String template, String parameter) {
        super("Missing parameter '" + parameter + "' for lock key " + template);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
