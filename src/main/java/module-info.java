/// Module for the input recording file library: a fixed-layout binary log of controller
/// input for deterministic replay.
module com.github.simbo1905.irf {
    requires java.logging;
    requires static lombok;
    exports com.github.simbo1905.irf;
}
