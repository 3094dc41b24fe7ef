package com.nevis.corpus.exception;

import lombok.Getter;
import org.springframework.boot.ExitCodeGenerator;

@Getter
public class MissingCredentialException extends RuntimeException implements ExitCodeGenerator {
    private final String credentialName;

    public MissingCredentialException(String credentialName) {
        super(credentialName + " not set (set it in the environment or in application.yml)");
        this.credentialName = credentialName;
    }

    @Override
    public int getExitCode() {
        return 1;
    }
}
