package com.paydispatch.transport;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.paydispatch.entity.Payment;
import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.transport.model.PaymentRequestResponse;
import com.paydispatch.transport.model.PaymentSummaryResponse;
import com.paydispatch.transport.model.ProcessorPaymentResponse;
import com.paydispatch.transport.model.ServiceHealthResponse;

import java.io.IOException;
import java.time.Instant;

public class JsonUtils {

    private static final ObjectMapper OBJECT_MAPPER;
    private static final JsonFactory JSON_FACTORY;
    private static final ObjectReader PAYMENT_REQUEST_READER;
    private static final ObjectReader SERVICE_HEALTH_READER;
    private static final ObjectReader PROCESSOR_RESPONSE_READER;
    private static final ObjectWriter DEFAULT_WRITER;

    static {
        JSON_FACTORY = new JsonFactory();
        OBJECT_MAPPER = new ObjectMapper(JSON_FACTORY);

        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        OBJECT_MAPPER.configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, false);
        OBJECT_MAPPER.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        OBJECT_MAPPER.registerModule(new JavaTimeModule());

        PAYMENT_REQUEST_READER = OBJECT_MAPPER.readerFor(PaymentRequestResponse.class);
        SERVICE_HEALTH_READER = OBJECT_MAPPER.readerFor(ServiceHealthResponse.class);
        PROCESSOR_RESPONSE_READER = OBJECT_MAPPER.readerFor(ProcessorPaymentResponse.class);
        DEFAULT_WRITER = OBJECT_MAPPER.writer();
    }

    private JsonUtils() {
    }

    /**
     * Reads a submission arriving at ingress. Any client-sent {@code requestedAt} is ignored and
     * the payment is stamped with the admission time.
     *
     * @throws IllegalArgumentException if the body is not valid JSON or lacks a required field
     */
    public static Payment parsePaymentRequest(byte[] jsonBytes) {
        PaymentRequestResponse request = readPaymentBody(jsonBytes);
        return new Payment(request.correlationId(), request.amount(), Instant.now());
    }

    public static Payment parseForwardedPayment(byte[] jsonBytes) {
        PaymentRequestResponse request = readPaymentBody(jsonBytes);
        return new Payment(request.correlationId(), request.amount(), request.requestedAt());
    }

    private static PaymentRequestResponse readPaymentBody(byte[] jsonBytes) {
        PaymentRequestResponse request;
        try {
            request = PAYMENT_REQUEST_READER.readValue(jsonBytes);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getMessage(), e);
        }
        if (request == null) {
            throw new IllegalArgumentException("Empty payment body");
        }
        return request;
    }

    public static byte[] toPaymentJsonBytes(Payment payment) {
        try {
            return DEFAULT_WRITER.writeValueAsBytes(new PaymentRequestResponse(
                    payment.correlationId(),
                    payment.amount(),
                    payment.requestedAt()
            ));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error creating payment JSON", e);
        }
    }

    public static byte[] toPaymentSummaryJsonBytes(PaymentSummary summary) {
        try {
            PaymentSummaryResponse response = PaymentSummaryResponse.from(summary);

            return DEFAULT_WRITER.writeValueAsBytes(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error creating payment summary JSON", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the body is not a health document
     */
    public static ServiceHealthResponse parseServiceHealth(String json) {
        try {
            ServiceHealthResponse response = SERVICE_HEALTH_READER.readValue(json);
            if (response == null || response.failing() == null) {
                throw new IllegalArgumentException("Health response has no 'failing' flag");
            }
            return response;
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid health response: " + e.getMessage(), e);
        }
    }

    public static String parseProcessorMessage(String json) {
        try {
            ProcessorPaymentResponse response = PROCESSOR_RESPONSE_READER.readValue(json);
            return response == null ? null : response.message();
        } catch (IOException e) {
            return null;
        }
    }
}
