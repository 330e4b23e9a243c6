package com.pumpfun.indexer.modules.chains.ledger;

import com.pumpfun.indexer.config.IndexerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.Log;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link LedgerSource} backed by a web3j HTTP client.
 * Log queries are scoped to the configured token factory contract.
 */
@Component
public class Web3jLedgerSource implements LedgerSource {

    private static final Logger logger = LoggerFactory.getLogger(Web3jLedgerSource.class);

    private static final Comparator<Log> LOG_ORDER = Comparator
            .comparing(Log::getBlockNumber)
            .thenComparing(Log::getLogIndex);

    private final Web3j web3j;
    private final String contractAddress;

    public Web3jLedgerSource(Web3j web3j, IndexerProperties properties) {
        this.web3j = web3j;
        this.contractAddress = properties.getContractAddress();
    }

    @Override
    public long getChainHeight() {
        EthBlockNumber response = send("eth_blockNumber", () -> web3j.ethBlockNumber().send());
        return response.getBlockNumber().longValueExact();
    }

    @Override
    public List<Log> getLogs(long fromBlock, long toBlock, String eventTopic) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
                contractAddress);
        filter.addSingleTopic(eventTopic);

        EthLog response = send("eth_getLogs", () -> web3j.ethGetLogs(filter).send());

        List<Log> logs = new ArrayList<>();
        for (EthLog.LogResult<?> result : response.getLogs()) {
            if (result instanceof EthLog.LogObject) {
                logs.add(((EthLog.LogObject) result).get());
            }
        }
        logs.sort(LOG_ORDER);
        logger.debug("Fetched {} logs: topic={}, range=[{}-{}]", logs.size(), eventTopic, fromBlock, toBlock);
        return logs;
    }

    @Override
    public String getTransactionSender(String txnHash) {
        EthTransaction response = send("eth_getTransactionByHash",
                () -> web3j.ethGetTransactionByHash(txnHash).send());
        return response.getTransaction()
                .map(org.web3j.protocol.core.methods.response.Transaction::getFrom)
                .orElseThrow(() -> new LedgerException("Transaction not found: " + txnHash));
    }

    @Override
    @SuppressWarnings("rawtypes")
    public String callStringMethod(String targetAddress, String methodName) {
        Function function = new Function(methodName, List.of(), List.of(new TypeReference<Utf8String>() {}));
        String encoded = FunctionEncoder.encode(function);

        EthCall response = send("eth_call " + methodName, () -> web3j.ethCall(
                Transaction.createEthCallTransaction(null, targetAddress, encoded),
                DefaultBlockParameterName.LATEST).send());

        List<Type> values = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
        if (values.isEmpty()) {
            throw new LedgerException("Empty result for " + methodName + "() on " + targetAddress);
        }
        return (String) values.get(0).getValue();
    }

    private <T extends Response<?>> T send(String method, RpcCall<T> call) {
        T response;
        try {
            response = call.execute();
        } catch (Exception e) {
            throw new LedgerException("Ledger call failed: " + method, e);
        }
        if (response.hasError()) {
            throw new LedgerException("Ledger call " + method + " returned error: "
                    + response.getError().getMessage());
        }
        return response;
    }

    @FunctionalInterface
    private interface RpcCall<T> {
        T execute() throws Exception;
    }
}
