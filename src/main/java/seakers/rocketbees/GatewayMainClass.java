package seakers.rocketbees;

import py4j.GatewayServer;
import seakers.rocketbees.gatewayclasses.AllocationOperations;

public class GatewayMainClass {

    private final AllocationOperations allocationOperations;

    public GatewayMainClass() {
        this.allocationOperations = new AllocationOperations();
    }

    public AllocationOperations getOperationsInstance() {
        return this.allocationOperations;
    }

    public static void main(String[] args) {
        GatewayServer gatewayServer = new GatewayServer(new GatewayMainClass());
        gatewayServer.start();
        System.out.println("Gateway Server started");
    }

}
