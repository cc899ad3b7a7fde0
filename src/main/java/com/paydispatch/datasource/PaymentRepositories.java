package com.paydispatch.datasource;

import com.paydispatch.config.DispatcherConfig;
import com.paydispatch.repository.PaymentRepository;

public final class PaymentRepositories {

    private PaymentRepositories() {
    }

    public static PaymentRepository create(DispatcherConfig config) {
        return switch (config.storeType()) {
            case POSTGRES -> JdbcPaymentRepository.connect(
                    config.databaseUrl(), config.databaseUser(), config.databasePassword());
            case REDIS -> new RedisPaymentRepository(config.valkeyHost(), config.valkeyPort());
        };
    }
}
