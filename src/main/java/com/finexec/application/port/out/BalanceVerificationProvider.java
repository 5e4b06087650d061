package com.finexec.application.port.out;

import com.finexec.domain.model.BalanceVerification;
import com.finexec.domain.model.BalanceVerificationRequest;
import io.vertx.core.Future;

/**
 * Output port for the accounting-equation verification service
 */
public interface BalanceVerificationProvider {

    Future<BalanceVerification> verify(BalanceVerificationRequest request);
}
