package com.cosign.multisig.execution;

import com.cosign.chain.ChainClient;
import com.cosign.chain.ChainClientRegistry;
import com.cosign.chain.ChainExecutionException;
import com.cosign.chain.ChainLog;
import com.cosign.chain.ChainReceipt;
import com.cosign.chain.ContractCall;
import com.cosign.chain.ExecutionFailureReason;
import com.cosign.chain.RpcException;
import com.cosign.chain.config.ChainProperties;
import com.cosign.domain.ChainId;
import com.cosign.multisig.typed.SafeContracts;
import com.cosign.multisig.typed.SafeTransaction;
import com.cosign.multisig.typed.SafeTypedDataBuilder;
import com.cosign.multisig.typed.TypedTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SafeOnChainExecutionAdapterTest {

    private static final String FACTORY = ChainProperties.DEFAULT_FACTORY_ADDRESS;
    private static final String SAFE = "0x2222222222222222222222222222222222222222";
    private static final String PROXY_WORD = "0x000000000000000000000000abababababababababababababababababababab";
    private static final List<String> OWNERS = List.of(
            "0x1000000000000000000000000000000000000001", "0x2000000000000000000000000000000000000002");

    private ChainClient client;
    private ChainProperties properties;
    private SafeOnChainExecutionAdapter adapter;

    @BeforeEach
    void setUp() {
        client = mock(ChainClient.class);
        when(client.chain()).thenReturn(ChainId.ETHEREUM);
        properties = new ChainProperties();
        properties.setReceiptTimeout(Duration.ofSeconds(5));
        ChainProperties.NetworkEntry entry = new ChainProperties.NetworkEntry();
        entry.setOnChainEnabled(true);
        entry.setUrls(List.of("http://localhost:8545"));
        entry.setRelayerAddress("0x7777777777777777777777777777777777777777");
        properties.getNetwork().put(ChainId.ETHEREUM, entry);
        ChainProperties.NetworkEntry polygon = new ChainProperties.NetworkEntry();
        polygon.setOnChainEnabled(false);
        properties.getNetwork().put(ChainId.POLYGON, polygon);

        ChainClientRegistry registry = new ChainClientRegistry(Map.of(ChainId.ETHEREUM, client, ChainId.POLYGON, client));
        adapter = new SafeOnChainExecutionAdapter(properties, registry, new SafeTypedDataBuilder());
    }

    @Test
    void supports_requiresEnabledEntryAndClient() {
        assertThat(adapter.supports(ChainId.ETHEREUM)).isTrue();
        assertThat(adapter.supports(ChainId.POLYGON)).isFalse();
        assertThat(adapter.supports(ChainId.BASE)).isFalse();
        assertThat(adapter.supports(ChainId.SOLANA)).isFalse();
        assertThat(adapter.supports(null)).isFalse();
    }

    @Test
    void deploy_parsesProxyFromFactoryEvent() {
        when(client.estimateGas(any())).thenReturn(BigInteger.valueOf(250_000));
        when(client.submit(any())).thenReturn("0xdeploy");
        when(client.waitForReceipt(eq("0xdeploy"), anyInt(), any())).thenReturn(new ChainReceipt("0xdeploy", 42L, true,
                "0x7777777777777777777777777777777777777777", FACTORY,
                List.of(new ChainLog(FACTORY, List.of(SafeContracts.PROXY_CREATION_TOPIC, PROXY_WORD), "0x"))));

        DeploymentResult result = adapter.deploy(new DeploymentRequest("wallet-1", ChainId.ETHEREUM, OWNERS, 2));

        assertThat(result.address()).isEqualTo("0xABaBaBaBABabABabAbAbABAbABabababaBaBABaB");
        assertThat(result.txHash()).isEqualTo("0xdeploy");
        assertThat(result.blockNumber()).isEqualTo(42L);
        assertThat(result.factory()).isEqualTo(FACTORY);

        ArgumentCaptor<ContractCall> submitted = ArgumentCaptor.forClass(ContractCall.class);
        verify(client).submit(submitted.capture());
        assertThat(submitted.getValue().to()).isEqualTo(FACTORY);
        assertThat(submitted.getValue().data()).startsWith("0x1688f0b9");
        assertThat(submitted.getValue().gasLimit()).isEqualTo(BigInteger.valueOf(250_000));
    }

    @Test
    void deploy_withoutProxyEvent_malformedReceipt() {
        when(client.estimateGas(any())).thenReturn(BigInteger.valueOf(250_000));
        when(client.submit(any())).thenReturn("0xdeploy");
        when(client.waitForReceipt(eq("0xdeploy"), anyInt(), any()))
                .thenReturn(new ChainReceipt("0xdeploy", 42L, true, null, FACTORY, List.of()));

        assertThatThrownBy(() -> adapter.deploy(new DeploymentRequest("wallet-1", ChainId.ETHEREUM, OWNERS, 2)))
                .isInstanceOf(ChainExecutionException.class)
                .satisfies(e -> assertThat(((ChainExecutionException) e).getReason()).isEqualTo(ExecutionFailureReason.MALFORMED_RECEIPT));
    }

    @Test
    void execute_revertedReceipt_reverted() {
        when(client.estimateGas(any())).thenReturn(BigInteger.valueOf(90_000));
        when(client.submit(any())).thenReturn("0xexec");
        when(client.waitForReceipt(eq("0xexec"), anyInt(), any()))
                .thenReturn(new ChainReceipt("0xexec", 43L, false, null, SAFE, List.of()));

        assertThatThrownBy(() -> adapter.execute(ChainId.ETHEREUM, SAFE, typed(), new byte[65]))
                .isInstanceOf(ChainExecutionException.class)
                .satisfies(e -> assertThat(((ChainExecutionException) e).getReason()).isEqualTo(ExecutionFailureReason.REVERTED));
    }

    @Test
    void execute_gasEstimationUnavailable_usesConfiguredLimit() {
        when(client.estimateGas(any())).thenThrow(new RpcException("connection refused"));
        when(client.submit(any())).thenReturn("0xexec");
        when(client.waitForReceipt(eq("0xexec"), anyInt(), any()))
                .thenReturn(new ChainReceipt("0xexec", 43L, true, "0x7777777777777777777777777777777777777777", SAFE, List.of()));

        ExecutionResult result = adapter.execute(ChainId.ETHEREUM, SAFE, typed(), new byte[65]);

        assertThat(result.txHash()).isEqualTo("0xexec");
        ArgumentCaptor<ContractCall> submitted = ArgumentCaptor.forClass(ContractCall.class);
        verify(client).submit(submitted.capture());
        assertThat(submitted.getValue().to()).isEqualTo(SAFE);
        assertThat(submitted.getValue().data()).startsWith("0x6a761202");
        assertThat(submitted.getValue().gasLimit()).isEqualTo(BigInteger.valueOf(300_000));
    }

    @Test
    void execute_estimationReverts_failsBeforeSubmit() {
        when(client.estimateGas(any())).thenThrow(RpcException.rpcError("eth_estimateGas", 3, "execution reverted: GS026"));

        assertThatThrownBy(() -> adapter.execute(ChainId.ETHEREUM, SAFE, typed(), new byte[65]))
                .satisfies(e -> assertThat(((ChainExecutionException) e).getReason()).isEqualTo(ExecutionFailureReason.REVERTED));
        verify(client, never()).submit(any());
    }

    @Test
    void buildTransaction_disabledChain_unsupported() {
        assertThatThrownBy(() -> adapter.buildTransaction(ChainId.POLYGON, SAFE, SAFE, BigInteger.ONE, null))
                .isInstanceOf(ChainExecutionException.class)
                .satisfies(e -> assertThat(((ChainExecutionException) e).getReason()).isEqualTo(ExecutionFailureReason.UNSUPPORTED_CHAIN));
    }

    @Test
    void buildTransaction_nonceLookupFails_classified() {
        when(client.chainId()).thenReturn(1L);
        when(client.call(any())).thenThrow(RpcException.timeout("eth_call", "http://localhost:8545"));

        assertThatThrownBy(() -> adapter.buildTransaction(ChainId.ETHEREUM, SAFE, SAFE, BigInteger.ONE, null))
                .satisfies(e -> assertThat(((ChainExecutionException) e).getReason()).isEqualTo(ExecutionFailureReason.TIMEOUT));
    }

    private static TypedTransaction typed() {
        return new SafeTypedDataBuilder().build(1L, SAFE,
                SafeTransaction.transfer("0x3333333333333333333333333333333333333333", BigInteger.ONE, null, BigInteger.ZERO));
    }
}
