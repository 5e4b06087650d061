package com.finexec.adapter.out.http;

import com.finexec.application.port.out.BalanceVerificationProvider;
import com.finexec.domain.model.BalanceVerification;
import com.finexec.domain.model.BalanceVerificationRequest;
import com.finexec.domain.model.VerificationSource;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Verification computed in-process from the derived sections, used when no external endpoint is configured
 */
@Slf4j
public class LocalBalanceVerificationAdapter implements BalanceVerificationProvider {

    private final BigDecimal tolerance;

    public LocalBalanceVerificationAdapter(BigDecimal tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public Future<BalanceVerification> verify(BalanceVerificationRequest request) {
        BigDecimal netFinancialAssets = request.computedValues().getNetFinancialAssets().getCumulativeBalance();
        BigDecimal closingBalance = request.computedValues().getClosingBalance().getCumulativeBalance();
        BigDecimal difference = netFinancialAssets.subtract(closingBalance);
        boolean balanced = difference.abs().compareTo(tolerance) <= 0;

        log.debug("Local verification of report {}: F={}, G={}, balanced={}",
                request.reportId(), netFinancialAssets, closingBalance, balanced);
        return Future.succeededFuture(new BalanceVerification(
                balanced, netFinancialAssets, closingBalance, difference, VerificationSource.LOCAL));
    }
}
