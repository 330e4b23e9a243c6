package com.pumpfun.indexer.modules.chains.events;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.List;

/**
 * Token factory event definitions and payload decoding.
 *
 * <p>All parameters are static 32-byte ABI words. Indexed parameters travel in topics[1..] and
 * the rest in the data section, so concatenating both yields the words in declaration order as
 * long as indexed parameters come first. That holds for every factory event.
 */
public final class TokenFactoryEvents {

    /**
     * TokenCreated(address token, uint256 timestamp)
     */
    public static final Event TOKEN_CREATED = new Event("TokenCreated", Arrays.<TypeReference<?>>asList(
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {}));

    /**
     * TokenBuy(address token, uint256 amount0In, uint256 amount0Out, uint256 fee, uint256 timestamp)
     */
    public static final Event TOKEN_BUY = new Event("TokenBuy", swapParameters());

    /**
     * TokenSell(address token, uint256 amount0In, uint256 amount0Out, uint256 fee, uint256 timestamp)
     */
    public static final Event TOKEN_SELL = new Event("TokenSell", swapParameters());

    public static final String TOKEN_CREATED_TOPIC = EventEncoder.encode(TOKEN_CREATED);
    public static final String TOKEN_BUY_TOPIC = EventEncoder.encode(TOKEN_BUY);
    public static final String TOKEN_SELL_TOPIC = EventEncoder.encode(TOKEN_SELL);

    private static final int WORD_HEX_LENGTH = 64;

    private TokenFactoryEvents() {
    }

    /**
     * Decode the parameters of {@code event} from a raw log.
     *
     * @throws IllegalArgumentException if the log topic does not match or the payload is too short
     */
    @SuppressWarnings("rawtypes")
    public static List<Type> decode(Log log, Event event) {
        List<String> topics = log.getTopics();
        String expectedTopic = EventEncoder.encode(event);
        if (topics == null || topics.isEmpty() || !expectedTopic.equalsIgnoreCase(topics.get(0))) {
            throw new IllegalArgumentException("Log " + log.getTransactionHash() + " is not a "
                    + event.getName() + " event");
        }

        StringBuilder words = new StringBuilder();
        for (String topic : topics.subList(1, topics.size())) {
            words.append(Numeric.cleanHexPrefix(topic));
        }
        if (log.getData() != null) {
            words.append(Numeric.cleanHexPrefix(log.getData()));
        }

        int expectedLength = event.getParameters().size() * WORD_HEX_LENGTH;
        if (words.length() < expectedLength) {
            throw new IllegalArgumentException("Malformed " + event.getName() + " payload in tx "
                    + log.getTransactionHash() + ": expected " + expectedLength + " hex chars, got " + words.length());
        }
        return FunctionReturnDecoder.decode(Numeric.prependHexPrefix(words.toString()), event.getParameters());
    }

    private static List<TypeReference<?>> swapParameters() {
        return Arrays.<TypeReference<?>>asList(
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {});
    }
}
