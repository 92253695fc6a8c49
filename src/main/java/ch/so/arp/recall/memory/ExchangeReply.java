package ch.so.arp.recall.memory;

public record ExchangeReply(String reply) {
}
